package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.model.graph.ParsedFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parse trees of one or more files, as produced by the extractor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    @Builder.Default
    private List<ParsedFile> files = new ArrayList<>();
}
