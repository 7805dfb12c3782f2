package org.dxworks.mdsplit.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FileSplit {
    public String kind = "file";
    public String filePath;
    public List<Section> sections = new ArrayList<>();
}
