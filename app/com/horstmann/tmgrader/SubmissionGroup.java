package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.List;

/**
 * One team's files for one assignment.
 */
public class SubmissionGroup {
    private final int id;
    private final Path root;
    private final List<Path> files;

    /**
     * @param id the group number
     * @param root the directory containing the files
     * @param files the files, relative to root
     */
    public SubmissionGroup(int id, Path root, List<Path> files) {
        this.id = id;
        this.root = root;
        this.files = List.copyOf(files);
    }

    public int getId() { return id; }
    public Path getRoot() { return root; }
    public List<Path> getFiles() { return files; }

    public String toString() {
        return "group " + id + " (" + root + ")";
    }
}
