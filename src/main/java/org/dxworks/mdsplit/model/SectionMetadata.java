package org.dxworks.mdsplit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"tokenCount", "modelVersion", "normalized", "error", "originalContent", "parents", "siblings"})
public class SectionMetadata {
    public Integer tokenCount; // set by downstream tools, never by the splitter
    public String modelVersion;
    public boolean normalized;
    public String error;
    public MarkdownContent originalContent; // content before normalization, when normalized is true
    public Map<String, String> parents = new LinkedHashMap<>(); // "h1" -> header, ascending level
    public List<String> siblings = new ArrayList<>(); // same level and same parents, document order
}
