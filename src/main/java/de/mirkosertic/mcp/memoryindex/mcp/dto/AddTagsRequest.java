package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.store.TagProvenance;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

public record AddTagsRequest(
        @Description("Id of an existing document.")
        long documentId,

        @Description("Tag names. Missing tags are created.")
        List<String> tags,

        @Nullable
        @Description("auto (default) or manual.")
        String provenance,

        @Nullable
        @Description("Confidence between 0.0 and 1.0. Default is 1.0.")
        Double confidence,

        @Nullable
        @Description("Category assigned to newly created tags.")
        String category
) {

    public static AddTagsRequest fromMap(final Map<String, Object> args) {
        final List<String> tags = Arguments.stringList(args, "tags");
        return new AddTagsRequest(
                Arguments.requireLong(args, "documentId"),
                tags == null ? List.of() : tags,
                Arguments.string(args, "provenance"),
                Arguments.decimal(args, "confidence"),
                Arguments.string(args, "category"));
    }

    public TagProvenance effectiveProvenance() {
        return TagProvenance.fromCode(provenance);
    }

    public double effectiveConfidence() {
        return confidence == null ? 1.0 : confidence;
    }
}
