package com.sqldumpextract;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.TreeSet;

public class ExtractionProfileLoader {

    public static ExtractionProfilesFile load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            Yaml yaml = new Yaml(new Constructor(ExtractionProfilesFile.class, new LoaderOptions()));
            ExtractionProfilesFile file = yaml.load(in);
            return file != null ? file : new ExtractionProfilesFile();
        } catch (YAMLException e) {
            throw new IOException("Invalid profile file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load the profile called {@code name}.
     *
     * @throws IllegalArgumentException if the file has no such profile
     */
    public static ExtractionProfile load(Path path, String name) throws IOException {
        ExtractionProfilesFile file = load(path);
        ExtractionProfile profile = file.getProfiles().get(name);
        if (profile == null) {
            throw new IllegalArgumentException("Profile '" + name + "' not found in " + path
                    + " (available: " + new TreeSet<>(file.getProfiles().keySet()) + ")");
        }
        return profile;
    }
}
