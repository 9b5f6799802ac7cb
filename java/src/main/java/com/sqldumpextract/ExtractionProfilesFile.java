package com.sqldumpextract;

import java.util.HashMap;
import java.util.Map;

public class ExtractionProfilesFile {
    private Map<String, ExtractionProfile> profiles = new HashMap<>();

    public ExtractionProfilesFile() {
    }

    public Map<String, ExtractionProfile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, ExtractionProfile> profiles) {
        this.profiles = profiles != null ? profiles : new HashMap<>();
    }
}
