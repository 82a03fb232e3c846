package de.bycsitsm.meetingcost.annotation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DescriptionEditorTest {

    private static final String BLOCK = "[[COST]]: 🟢 $125\n└─ Invited cost: 🟢 $250 (2 invited → 1 attending)";

    private final DescriptionEditor editor = new DescriptionEditor("[[COST]]");

    @Test
    void empty_description_becomes_the_block() {
        assertThat(editor.apply(null, BLOCK).description()).isEqualTo(BLOCK);
        assertThat(editor.apply("  ", BLOCK).description()).isEqualTo(BLOCK);
    }

    @Test
    void block_is_inserted_before_existing_content() {
        var edit = editor.apply("Agenda:\n- budget", "[[COST]]: 🟢 $250");

        assertThat(edit.description()).isEqualTo("[[COST]]: 🟢 $250\n\nAgenda:\n- budget");
        assertThat(edit.blocksFound()).isZero();
    }

    @Test
    void existing_block_is_replaced_in_place() {
        var description = "Intro\n[[COST]]: 🟢 $250\nAgenda:\n- budget";

        var edit = editor.apply(description, BLOCK);

        assertThat(edit.description()).isEqualTo("Intro\n" + BLOCK + "\nAgenda:\n- budget");
        assertThat(edit.blocksFound()).isEqualTo(1);
    }

    @Test
    void stale_detail_line_is_removed_with_its_block() {
        var description = BLOCK + "\n\nAgenda";

        var edit = editor.apply(description, "[[COST]]: 🟢 $250");

        assertThat(edit.description()).isEqualTo("[[COST]]: 🟢 $250\n\nAgenda");
    }

    @Test
    void applying_the_same_block_twice_is_stable() {
        var once = editor.apply("Agenda", BLOCK).description();
        var twice = editor.apply(once, BLOCK).description();

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void only_the_first_of_several_blocks_is_replaced() {
        var description = "[[COST]]: 🟢 $100\nnotes\n[[COST]]: 🟢 $200";

        var edit = editor.apply(description, "[[COST]]: 🟢 $250");

        assertThat(edit.description()).isEqualTo("[[COST]]: 🟢 $250\nnotes\n[[COST]]: 🟢 $200");
        assertThat(edit.blocksFound()).isEqualTo(2);
    }

    @Test
    void tag_must_start_the_line() {
        var edit = editor.apply("see [[COST]] below", "[[COST]]: 🟢 $250");

        assertThat(edit.description()).isEqualTo("[[COST]]: 🟢 $250\n\nsee [[COST]] below");
    }

    @Test
    void tag_without_colon_is_not_an_annotation() {
        var edit = editor.apply("[[COST]]s reviewed\n[[COST]] pending", "[[COST]]: 🟢 $250");

        assertThat(edit.description()).isEqualTo("[[COST]]: 🟢 $250\n\n[[COST]]s reviewed\n[[COST]] pending");
        assertThat(edit.blocksFound()).isZero();
    }
}
