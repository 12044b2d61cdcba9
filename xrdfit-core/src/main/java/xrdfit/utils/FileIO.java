/*
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of XRDFIT
 *
 * XRDFIT is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * XRDFIT is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with XRDFIT.  If not, see <http://www.gnu.org/licenses/>.
 */
package xrdfit.utils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 *
 * @author Jean Ollion
 */
public class FileIO {
    public static final Logger logger = LoggerFactory.getLogger(FileIO.class);

    /**
     * Writes {@param text} at the end of the file (on a new line) or replaces its content
     */
    public static void write(RandomAccessFile raf, String text, boolean append) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (append) {
            long l = raf.length();
            raf.seek(l);
            if (l>0) raf.writeBytes("\n");
            raf.write(bytes);
        } else {
            raf.setLength(0);
            raf.write(bytes);
        }
    }

    public static <T> void writeToFile(String outputFile, Collection<T> objects, Function<T, String> converter) throws IOException {
        File output = new File(outputFile);
        if (output.getParentFile()!=null) output.getParentFile().mkdirs();
        List<String> toWrite = objects.stream().map(converter).filter(Objects::nonNull).collect(Collectors.toList());
        if (toWrite.size()!=objects.size()) logger.error("#{} objects could not be converted", objects.size()-toWrite.size());
        try (BufferedWriter out = Files.newBufferedWriter(output.toPath())) {
            Iterator<String> it = toWrite.iterator();
            if (it.hasNext()) out.write(it.next());
            while(it.hasNext()) {
                out.newLine();
                out.write(it.next());
            }
        }
    }

    public static List<String> readLines(Path path, Charset charset) throws IOException {
        List<String> res = new ArrayList<>();
        try (BufferedReader bufRead = Files.newBufferedReader(path, charset)) {
            String myLine;
            while ( (myLine = bufRead.readLine()) != null) res.add(myLine);
        }
        return res;
    }

    /**
     * @param converter applied on each line. Lines for which it returns null or throws an exception are skipped
     */
    public static <T> List<T> readFromFile(Path path, Charset charset, Function<String, T> converter) throws IOException {
        List<String> lines = readLines(path, charset);
        List<T> res = new ArrayList<>(lines.size());
        for (String l : lines) {
            try {
                T t = converter.apply(l);
                if (t!=null) res.add(t);
            } catch (RuntimeException e) {
                logger.trace("line could not be converted: {}", l);
            }
        }
        return res;
    }

    /**
     * @return regular files of {@param dir} accepted by {@param filter}, sorted by file name
     */
    public static List<Path> listFiles(Path dir, Predicate<Path> filter) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile).filter(filter).sorted(Comparator.comparing(p -> p.getFileName().toString())).collect(Collectors.toList());
        }
    }

    public static String getExtension(Path file) {
        String name = file.getFileName().toString();
        int idx = name.lastIndexOf('.');
        return idx<0 ? "" : name.substring(idx+1).toLowerCase(Locale.ROOT);
    }
    public static String removeExtension(Path file) {
        String name = file.getFileName().toString();
        int idx = name.lastIndexOf('.');
        return idx<0 ? name : name.substring(0, idx);
    }
}
