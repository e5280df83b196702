package edu.colorado.clear.vn;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import org.xml.sax.EntityResolver;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import edu.colorado.clear.vn.common.util.FileUtil;
import edu.colorado.clear.vn.common.xml.XMLNode;
import edu.colorado.clear.vn.common.xml.XMLTreeReader;

/**
 * Reads a VerbNet corpus (a directory of class documents or a zip archive of
 * them) into a flat list of {@link VNClass}. Documents are parsed and
 * extracted in parallel; the result keeps document discovery order. The first
 * failing or timed out document aborts the whole read.
 *
 * @author shumin
 */
public class VNCorpusReader {

    private static Logger logger = Logger.getLogger("clearvn");

    public static final String DEFAULT_FILE_REGEX = ".+\\.xml";
    public static final long DEFAULT_TIMEOUT = 60;
    static final int MAX_THREADS = 40;

    File location;
    String fileRegex;
    int threads;
    long timeout;
    VNClassExtractor extractor;

    public VNCorpusReader(File location) {
        this.location = location;
        this.fileRegex = DEFAULT_FILE_REGEX;
        this.threads = parseThreadCount("auto");
        this.timeout = DEFAULT_TIMEOUT;
        this.extractor = new VNClassExtractor();
    }

    /**
     * @param props corpus properties with the <code>verbnet.</code> prefix
     * already removed: <code>dir</code>, <code>file_regex</code>,
     * <code>threads</code>, <code>timeout</code>, <code>strict_frames</code>
     */
    public VNCorpusReader(Properties props) throws VerbNetException {
        String dir = props.getProperty("dir");
        if (dir==null || dir.trim().isEmpty())
            throw new VerbNetException("VerbNet location (dir) is not set");
        this.location = new File(dir.trim());
        this.fileRegex = props.getProperty("file_regex", DEFAULT_FILE_REGEX);
        this.threads = parseThreadCount(props.getProperty("threads", "auto"));
        try {
            this.timeout = Long.parseLong(props.getProperty("timeout", Long.toString(DEFAULT_TIMEOUT)).trim());
        } catch (NumberFormatException e) {
            throw new VerbNetException("invalid timeout: "+props.getProperty("timeout"), e);
        }
        if (this.timeout<=0)
            throw new VerbNetException("timeout must be positive: "+props.getProperty("timeout"));
        this.extractor = new VNClassExtractor(Boolean.parseBoolean(props.getProperty("strict_frames", "false").trim()));
    }

    /**
     * @param threadCnt a positive number, or <code>auto</code>
     * @return number of worker threads to use
     */
    static int parseThreadCount(String threadCnt) {
        int threads = -1;
        if (threadCnt.trim().equals("auto")) {
            threads = Runtime.getRuntime().availableProcessors();
            // more than 4 processors is probably hyper-thread cores
            if (threads>4)
                threads = threads/2;
        } else
            try {
                threads = Integer.parseInt(threadCnt.trim());
            } catch (NumberFormatException e) {
                threads = -1;
            }
        if (threads<=0) threads = Runtime.getRuntime().availableProcessors();
        if (threads>MAX_THREADS) threads = MAX_THREADS;
        return threads;
    }

    public File getLocation() {
        return location;
    }

    public void setFileRegex(String fileRegex) {
        this.fileRegex = fileRegex;
    }

    public void setThreads(int threads) {
        this.threads = threads<=0?parseThreadCount("auto"):Math.min(threads, MAX_THREADS);
    }

    public int getThreads() {
        return threads;
    }

    /**
     * @param timeout maximum number of seconds to wait for each document, must
     * be positive
     */
    public void setTimeout(long timeout) {
        if (timeout<=0)
            throw new IllegalArgumentException("timeout must be positive: "+timeout);
        this.timeout = timeout;
    }

    public long getTimeout() {
        return timeout;
    }

    public void setExtractor(VNClassExtractor extractor) {
        this.extractor = extractor;
    }

    public VNClassExtractor getExtractor() {
        return extractor;
    }

    /**
     * Where class documents and their DTDs are read from.
     */
    static abstract class DocumentSource implements EntityResolver {
        abstract List<String> listDocuments(String regex) throws IOException;

        abstract Reader openDocument(String name) throws IOException;

        abstract String getSystemId(String name);

        void close() throws IOException {
        }
    }

    static class DirectorySource extends DocumentSource {
        File dir;

        DirectorySource(File dir) {
            this.dir = dir;
        }

        File getFile(String name) {
            return dir.isDirectory()?new File(dir, name):dir;
        }

        @Override
        List<String> listDocuments(String regex) throws IOException {
            return FileUtil.getFiles(dir, regex);
        }

        @Override
        Reader openDocument(String name) throws IOException {
            return new InputStreamReader(new FileInputStream(getFile(name)), StandardCharsets.UTF_8);
        }

        @Override
        String getSystemId(String name) {
            return getFile(name).toURI().toString();
        }

        @Override
        public InputSource resolveEntity(String publicId, String systemId) throws IOException {
            if (systemId==null)
                return null;
            File dtdFile = new File(dir.isDirectory()?dir:dir.getParentFile(), FileUtil.getBaseName(systemId));
            if (!dtdFile.isFile())
                return null;
            InputSource source = new InputSource(new InputStreamReader(new FileInputStream(dtdFile), StandardCharsets.UTF_8));
            source.setSystemId(dtdFile.toURI().toString());
            return source;
        }
    }

    static class ZipSource extends DocumentSource {
        ZipFile zipFile;

        ZipSource(File file) throws IOException {
            zipFile = new ZipFile(file);
        }

        @Override
        List<String> listDocuments(String regex) {
            return FileUtil.getZipEntries(zipFile, regex);
        }

        @Override
        Reader openDocument(String name) throws IOException {
            ZipEntry entry = zipFile.getEntry(name);
            if (entry==null)
                throw new IOException(name+" not found in "+zipFile.getName());
            return new InputStreamReader(zipFile.getInputStream(entry), StandardCharsets.UTF_8);
        }

        @Override
        String getSystemId(String name) {
            return name;
        }

        @Override
        public InputSource resolveEntity(String publicId, String systemId) throws IOException {
            if (systemId==null)
                return null;
            String baseName = FileUtil.getBaseName(systemId);
            for (ZipEntry entry:Collections.list(zipFile.entries()))
                if (!entry.isDirectory() && FileUtil.getBaseName(entry.getName()).equals(baseName))
                    return new InputSource(new InputStreamReader(zipFile.getInputStream(entry), StandardCharsets.UTF_8));
            return null;
        }

        @Override
        void close() throws IOException {
            zipFile.close();
        }
    }

    class DocumentTask implements Callable<List<VNClass>> {
        DocumentSource source;
        String name;

        DocumentTask(DocumentSource source, String name) {
            this.source = source;
            this.name = name;
        }

        @Override
        public List<VNClass> call() throws VerbNetException {
            XMLNode root;
            try (Reader reader = source.openDocument(name)) {
                InputSource input = new InputSource(reader);
                input.setSystemId(source.getSystemId(name));
                root = new XMLTreeReader(source).read(input);
            } catch (SAXException e) {
                throw new MalformedDocumentException(name, e);
            } catch (IOException e) {
                throw new MalformedDocumentException(name, e);
            }
            List<VNClass> classes = extractor.extractClasses(root, name);
            logger.fine(name+": "+classes.size()+" classes");
            return classes;
        }
    }

    DocumentSource openSource() throws VerbNetException {
        if (location.isFile() && location.getName().endsWith(".zip"))
            try {
                return new ZipSource(location);
            } catch (IOException e) {
                throw new VerbNetException(location.getPath(), "cannot open archive", e);
            }
        if (!location.exists())
            throw new VerbNetException(location.getPath(), "does not exist", null);
        return new DirectorySource(location);
    }

    /**
     * Reads every class document of the corpus.
     * @return all classes, subclasses flattened, in document order
     * @throws MalformedDocumentException a document is not well-formed or cannot be read
     * @throws CorpusIntegrityException a document misses required structure
     * @throws VerbNetException the corpus cannot be listed, or a document timed out
     */
    public List<VNClass> read() throws VerbNetException {
        logger.info("Reading VerbNet classes from "+location.getPath());

        DocumentSource source = openSource();
        ExecutorService executor = null;
        try {
            List<String> names;
            try {
                names = source.listDocuments(fileRegex);
            } catch (IOException e) {
                throw new VerbNetException(location.getPath(), "cannot list documents", e);
            }
            logger.info(names.size()+" class files found");
            if (names.isEmpty()) {
                logger.warning("no class documents matching "+fileRegex+" in "+location.getPath());
                return new ArrayList<VNClass>();
            }

            executor = Executors.newFixedThreadPool(Math.min(threads, names.size()));
            List<Future<List<VNClass>>> futures = new ArrayList<Future<List<VNClass>>>(names.size());
            for (String name:names)
                futures.add(executor.submit(new DocumentTask(source, name)));

            List<VNClass> classes = new ArrayList<VNClass>();
            for (int i=0; i<names.size(); ++i)
                classes.addAll(waitFor(names.get(i), futures.get(i)));

            logger.info(classes.size()+" classes read");
            return classes;
        } finally {
            if (executor!=null)
                executor.shutdownNow();
            try {
                source.close();
            } catch (IOException e) {
                logger.warning("cannot close "+location.getPath()+": "+e);
            }
        }
    }

    List<VNClass> waitFor(String name, Future<List<VNClass>> future) throws VerbNetException {
        try {
            return future.get(timeout, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VerbNetException)
                throw (VerbNetException)cause;
            if (cause instanceof Error)
                throw (Error)cause;
            throw new VerbNetException(name, "extraction failed: "+cause, cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new VerbNetException(name, "timed out after "+timeout+" seconds", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VerbNetException(name, "interrupted", e);
        }
    }
}
