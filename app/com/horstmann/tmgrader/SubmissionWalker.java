package com.horstmann.tmgrader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the submission groups in a folder. Each direct child that is a directory or a
 * zip file is one group, numbered by the first integer in its name. Zip files are
 * extracted into a scratch directory that close removes.
 */
public class SubmissionWalker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionWalker.class);
    private static final Pattern GROUP_NUMBER = Pattern.compile("\\d+");

    private final Path root;
    private Path scratch;

    public SubmissionWalker(Path root) {
        this.root = root;
    }

    /**
     * @param only the group numbers to include, or an empty set for all groups
     * @return the groups, sorted by number
     */
    public List<SubmissionGroup> walk(Set<Integer> only) throws IOException {
        if (!Files.isDirectory(root)) throw new GraderException("No such directory: " + root);
        TreeMap<Integer, Path> entries = new TreeMap<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(root)) {
            for (Path child : children) {
                String name = child.getFileName().toString();
                if (Util.isIgnored(child.getFileName())) continue;
                boolean zip = Files.isRegularFile(child) && name.toLowerCase().endsWith(".zip");
                if (!zip && !Files.isDirectory(child)) continue;
                Matcher matcher = GROUP_NUMBER.matcher(name);
                if (!matcher.find()) {
                    logger.warn("Skipping {}: no group number in its name", name);
                    continue;
                }
                int id;
                try {
                    id = Integer.parseInt(matcher.group());
                } catch (NumberFormatException ex) {
                    logger.warn("Skipping {}: group number {} is out of range", name, matcher.group());
                    continue;
                }
                if (!only.isEmpty() && !only.contains(id)) continue;
                Path previous = entries.putIfAbsent(id, child);
                if (previous != null)
                    logger.warn("Skipping {}: group {} is already {}", name, id, previous.getFileName());
            }
        }
        List<SubmissionGroup> groups = new ArrayList<>();
        for (int id : entries.keySet()) {
            Path entry = entries.get(id);
            Path dir = Files.isDirectory(entry) ? entry : extract(id, entry);
            groups.add(new SubmissionGroup(id, dir, Util.descendantFiles(dir)));
        }
        logger.info("Found {} groups in {}", groups.size(), root);
        return groups;
    }

    private Path extract(int id, Path zip) throws IOException {
        if (scratch == null) scratch = Files.createTempDirectory("tmgrader-submissions");
        Path target = scratch.resolve("group" + id);
        Files.createDirectories(target);
        try (InputStream in = Files.newInputStream(zip)) {
            Util.unzip(in, target);
        }
        logger.debug("Extracted {} to {}", zip, target);
        return target;
    }

    @Override
    public void close() {
        try {
            Util.deleteDirectory(scratch);
        } catch (IOException ex) {
            logger.warn("Cannot delete " + scratch, ex);
        }
    }
}
