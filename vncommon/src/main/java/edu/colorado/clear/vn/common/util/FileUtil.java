package edu.colorado.clear.vn.common.util;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

public class FileUtil {

    /**
     * Recursively lists the files under <code>dir</code> whose names match
     * <code>regex</code>, in sorted order. Hidden directories are skipped.
     * @param dir directory to search, or a single file
     * @param regex pattern the file name (not path) must match
     * @return paths relative to <code>dir</code>
     */
    static public List<String> getFiles(File dir, String regex) throws IOException {
        return getFiles(dir, Pattern.compile(regex));
    }

    static public List<String> getFiles(File dir, Pattern pattern) throws IOException {
        List<String> fileNames = new ArrayList<String>();
        if (!dir.isDirectory()) {
            if (!dir.exists())
                throw new IOException(dir.getPath()+" does not exist");
            if (pattern.matcher(dir.getName()).matches())
                fileNames.add(dir.getName());
            return fileNames;
        }

        File[] files = dir.listFiles();
        if (files==null)
            throw new IOException("cannot list "+dir.getPath());
        Arrays.sort(files);

        for (File file:files) {
            if (file.isDirectory()) {
                if (file.getName().startsWith("."))
                    continue;
                for (String fileName:getFiles(file, pattern))
                    fileNames.add(file.getName()+File.separatorChar+fileName);
            } else if (pattern.matcher(file.getName()).matches())
                fileNames.add(file.getName());
        }
        return fileNames;
    }

    /**
     * Lists the entries of a zip archive whose base names match
     * <code>regex</code>, sorted by entry name.
     */
    static public List<String> getZipEntries(ZipFile zipFile, String regex) {
        Pattern pattern = Pattern.compile(regex);
        List<String> entryNames = new ArrayList<String>();
        for (Enumeration<? extends ZipEntry> e = zipFile.entries(); e.hasMoreElements();) {
            ZipEntry entry = e.nextElement();
            if (entry.isDirectory())
                continue;
            if (pattern.matcher(getBaseName(entry.getName())).matches())
                entryNames.add(entry.getName());
        }
        Collections.sort(entryNames);
        return entryNames;
    }

    static public String getBaseName(String path) {
        int idx = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return idx<0?path:path.substring(idx+1);
    }
}
