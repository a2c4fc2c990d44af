package util;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FileDealer {

    private FileDealer() {
    }

    // whole file as text, "" if it cannot be read
    public static String readAll(String filename) {
        try {
            return new String(Files.readAllBytes(Paths.get(filename)), StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            System.err.println("cannot read " + filename + ": " + e.getMessage());
            return "";
        }
    }

    public static String changeExtension(String filename, String extension) {
        int lastDot = filename.lastIndexOf('.');
        if (lastDot < 0) {
            return filename + extension;
        }
        return filename.substring(0, lastDot) + extension;
    }

    /**
     * Writes {@code content} under the base name of {@code filename} in the working directory,
     * falling back to {@code filename} itself.
     *
     * @return the path written, or null when both attempts failed
     */
    public static String writeOutput(String filename, String content) {
        Path fileName = Paths.get(filename).getFileName();
        String basename = fileName == null ? filename : fileName.toString();
        if (outputToFile(content, basename)) {
            return basename;
        }
        System.err.println("Error: could not save to " + basename + ". Trying the original location.");
        if (outputToFile(content, filename)) {
            return filename;
        }
        return null;
    }

    public static boolean outputToFile(String content, String filename) {
        try (OutputStream out = new FileOutputStream(filename)) {
            outputToStream(content, out);
            return true;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("cannot write " + filename + ": " + e.getMessage());
            return false;
        }
    }

    public static void outputToStream(String content, OutputStream s) {
        try {
            s.write(content.getBytes(StandardCharsets.UTF_8));
            s.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
