package de.bycsitsm.meetingcost.annotation;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Replaces the annotation block inside a free-text description.
 * <p>
 * A block starts at a line beginning with the tag literal followed by a colon. It includes
 * the detail lines ({@code └─ ...}) directly below it. Only the first block is replaced;
 * lines before and after it are kept in order. Descriptions edited by hand may contain more than one block.
 * Those extra blocks are left alone and reported through {@link Edit#blocksFound()} so the
 * caller can flag them.
 */
final class DescriptionEditor {

    private final String marker;

    DescriptionEditor(String tag) {
        this.marker = tag + ":";
    }

    /**
     * Result of applying a block to a description.
     *
     * @param description the new description
     * @param blocksFound the number of annotation blocks in the original description
     */
    record Edit(String description, int blocksFound) {
    }

    Edit apply(@Nullable String description, String block) {
        if (description == null || description.isBlank()) {
            return new Edit(block, 0);
        }

        var lines = Arrays.asList(description.split("\n", -1));
        var first = -1;
        var blocks = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith(marker)) {
                blocks++;
                if (first < 0) {
                    first = i;
                }
            }
        }

        if (first < 0) {
            return new Edit(block + "\n\n" + description, 0);
        }

        var end = first + 1;
        while (end < lines.size() && lines.get(end).startsWith(AnnotationRenderer.DETAIL_PREFIX)) {
            end++;
        }

        List<String> result = new ArrayList<>(lines.subList(0, first));
        result.addAll(Arrays.asList(block.split("\n", -1)));
        result.addAll(lines.subList(end, lines.size()));
        return new Edit(String.join("\n", result), blocks);
    }
}
