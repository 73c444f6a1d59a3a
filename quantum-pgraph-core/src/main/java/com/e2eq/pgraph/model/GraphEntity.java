package com.e2eq.pgraph.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for composite objects written through decomposition. The fields here map
 * to the shared columns every row carries; subclasses add their own literal fields and
 * references to other entities.
 */
public abstract class GraphEntity {

    private String pid;
    private String label;
    private String description;
    private List<String> altids = new ArrayList<>();

    public String getPid() {
        return pid;
    }

    public void setPid(String pid) {
        this.pid = pid;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getAltids() {
        return altids;
    }

    public void setAltids(List<String> altids) {
        this.altids = altids;
    }
}
