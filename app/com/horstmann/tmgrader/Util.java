package com.horstmann.tmgrader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Scanner;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

public class Util {

    // String handling

    public static <T> String join(Collection<T> items, String separator) {
        return items.stream().map(Object::toString).collect(Collectors.joining(separator));
    }

    /**
     * Splits text into lines, dropping a leading BOM and trailing blank lines.
     */
    public static List<String> lines(String contents) {
        List<String> r = new ArrayList<String>();
        if (contents == null) return r;
        Scanner in = new Scanner(contents);
        boolean first = true;
        while (in.hasNextLine()) {
            if (first) {
                r.add(in.nextLine().replace("\uFEFF", "")); // strip out BOM.
                first = false;
            }
            else r.add(in.nextLine());
        }
        in.close();
        int i = r.size() - 1;
        while (i >= 0 && r.get(i).trim().isEmpty()) { r.remove(i); i--; }
        return r;
    }

    /**
     * Quotes a string for use as a single word in a POSIX shell command.
     */
    public static String shellQuote(String s) {
        if (s.matches("[A-Za-z0-9_./=:-]+")) return s;
        return "'" + s.replace("'", "'\\''") + "'";
    }

    // Paths

    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int n = name.lastIndexOf('.');
        if (n == -1)
            return "";
        else
            return name.substring(n + 1).toLowerCase();
    }

    public static String stem(Path p) {
        String result = p.getFileName().toString();
        int n = result.lastIndexOf(".");
        if (n > 0) result = result.substring(0, n);
        return result;
    }

    /**
     * Tests whether a relative path passes through a hidden file or directory,
     * or through the __MACOSX folder that the macOS archiver adds.
     */
    public static boolean isIgnored(Path relative) {
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".") || name.equals("__MACOSX")) return true;
        }
        return false;
    }

    // Files

    public static String read(Path path) {
        try {
            String result = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            return result.replaceAll("\r", "");
        } catch (IOException ex) {
            return null;
        }
    }

    public static void deleteDirectory(Path start) throws IOException {
        if (start == null) return;
        if (!Files.exists(start)) return;
        Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file,
                    BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException e)
                    throws IOException {
                if (e == null) {
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                } else {
                    // directory iteration failed
                    throw e;
                }
            }
        });
    }

    /**
     * Yields the relative paths of all regular files below dir, sorted, skipping
     * hidden entries and __MACOSX.
     */
    public static List<Path> descendantFiles(Path dir) throws IOException {
        TreeSet<Path> result = new TreeSet<>();
        if (dir == null || !Files.exists(dir))
            return new ArrayList<>(result);
        Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                if (!d.equals(dir) && isIgnored(dir.relativize(d)))
                    return FileVisitResult.SKIP_SUBTREE;
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file,
                    BasicFileAttributes attrs) {
                Path relative = dir.relativize(file);
                if (attrs.isRegularFile() && !isIgnored(relative))
                    result.add(relative);
                return FileVisitResult.CONTINUE;
            }
        });
        return new ArrayList<>(result);
    }

    /**
     * Extracts a zip archive into a directory. Entries that would escape the target
     * directory are skipped.
     */
    public static void unzip(InputStream in, Path targetDir) throws IOException {
        Path root = targetDir.toAbsolutePath().normalize();
        try (ZipInputStream zin = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zin.getNextEntry()) != null) {
                String name = entry.getName();
                Path target = root.resolve(name).normalize();
                if (!entry.isDirectory() && !name.startsWith("__MACOSX") && !name.endsWith(".DS_Store")
                        && target.startsWith(root)) {
                    Files.createDirectories(target.getParent());
                    Files.write(target, zin.readAllBytes());
                }
                zin.closeEntry();
            }
        }
    }
}
