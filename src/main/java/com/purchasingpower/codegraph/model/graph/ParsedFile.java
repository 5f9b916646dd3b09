package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of one file's parse tree as returned by the extractor: {@code {file, code, children[]}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParsedFile {

    public static final String UNKNOWN_FILE = "unknown_file";

    private String file;

    private String code;

    @Builder.Default
    private List<ParsedNode> children = new ArrayList<>();

    /**
     * The file itself as a {@code file}-typed tree node at line 0.
     */
    public ParsedNode toFileNode() {
        return ParsedNode.builder()
                .type(NodeKind.FILE.getTypeName())
                .name(file != null && !file.isBlank() ? file : UNKNOWN_FILE)
                .lineno(0)
                .code(code != null ? code : "")
                .parameters(new ArrayList<>())
                .children(children != null ? children : new ArrayList<>())
                .build();
    }
}
