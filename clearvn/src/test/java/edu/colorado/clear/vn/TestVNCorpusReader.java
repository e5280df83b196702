package edu.colorado.clear.vn;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.colorado.clear.vn.common.xml.XMLNode;

public class TestVNCorpusReader {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    File vnDir;

    @Before
    public void setUp() throws Exception {
        vnDir = new File(TestVNCorpusReader.class.getResource("/verbnet").toURI());
    }

    static void write(File file, String text) throws IOException {
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
            writer.write(text);
        }
    }

    static List<String> getIds(List<VNClass> classes) {
        List<String> ids = new ArrayList<String>();
        for (VNClass vnClass:classes)
            ids.add(vnClass.getId());
        return ids;
    }

    @Test
    public void testRead() throws Exception {
        List<VNClass> classes = new VNCorpusReader(vnDir).read();
        assertEquals(4, classes.size());
        assertEquals("want-32.1", classes.get(0).getId());
        assertEquals("wish-62", classes.get(3).getId());
    }

    @Test
    public void testThreadCountDoesNotChangeOrder() throws Exception {
        File dir = folder.newFolder("many");
        for (int i=0; i<12; ++i)
            write(new File(dir, String.format("c%02d.xml", i)),
                    "<VNCLASS ID=\"c-"+i+"\"><MEMBERS><MEMBER name=\"m"+i+"\"/></MEMBERS>"+
                    "<SUBCLASSES><VNSUBCLASS ID=\"c-"+i+"-1\"/></SUBCLASSES></VNCLASS>");

        VNCorpusReader reader = new VNCorpusReader(dir);
        reader.setThreads(1);
        List<String> serial = getIds(reader.read());
        reader.setThreads(4);
        List<String> parallel = getIds(reader.read());

        assertEquals(24, serial.size());
        assertEquals("c-0", serial.get(0));
        assertEquals("c-0-1", serial.get(1));
        assertEquals("c-11-1", serial.get(23));
        assertEquals(serial, parallel);
    }

    @Test
    public void testZipCorpus() throws Exception {
        File zip = new File(folder.getRoot(), "verbnet.zip");
        try (ZipOutputStream out = new ZipOutputStream(new FileOutputStream(zip))) {
            out.putNextEntry(new ZipEntry("verbnet/"));
            out.closeEntry();
            for (String name:new String[]{"wish-62.xml", "want-32.1.xml"}) {
                out.putNextEntry(new ZipEntry("verbnet/"+name));
                out.write(Files.readAllBytes(new File(vnDir, name).toPath()));
                out.closeEntry();
            }
            out.putNextEntry(new ZipEntry("verbnet/README"));
            out.write("not a class".getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }

        List<VNClass> fromZip = new VNCorpusReader(zip).read();
        assertEquals(getIds(new VNCorpusReader(vnDir).read()), getIds(fromZip));
    }

    @Test
    public void testFileRegex() throws Exception {
        VNCorpusReader reader = new VNCorpusReader(vnDir);
        reader.setFileRegex("wish-.+\\.xml");
        List<VNClass> classes = reader.read();
        assertEquals(1, classes.size());
        assertEquals("wish-62", classes.get(0).getId());
    }

    @Test
    public void testEmptyCorpus() throws Exception {
        File dir = folder.newFolder("empty");
        write(new File(dir, "notes.txt"), "nothing here");
        assertTrue(new VNCorpusReader(dir).read().isEmpty());
        assertEquals(0, VerbNet.load(dir).size());
    }

    @Test
    public void testMissingLocation() throws Exception {
        try {
            new VNCorpusReader(new File(folder.getRoot(), "missing")).read();
            fail("missing corpus accepted");
        } catch (VerbNetException e) {
            assertFalse(e instanceof MalformedDocumentException);
            assertFalse(e instanceof CorpusIntegrityException);
        }
    }

    @Test
    public void testMalformedDocument() throws Exception {
        File dir = folder.newFolder("malformed");
        write(new File(dir, "a-1.xml"), "<VNCLASS ID=\"a-1\"/>");
        write(new File(dir, "b-1.xml"), "<VNCLASS ID=\"b-1\"><MEMBERS></VNCLASS>");
        try {
            new VNCorpusReader(dir).read();
            fail("malformed document accepted");
        } catch (MalformedDocumentException e) {
            assertEquals("b-1.xml", e.getDocumentName());
            assertTrue(e.getMessage().startsWith("b-1.xml"));
        }
    }

    @Test
    public void testIncompleteDocument() throws Exception {
        File dir = folder.newFolder("incomplete");
        write(new File(dir, "a-1.xml"), "<VNCLASS><MEMBERS/></VNCLASS>");
        try {
            new VNCorpusReader(dir).read();
            fail("class without id accepted");
        } catch (CorpusIntegrityException e) {
            assertEquals("a-1.xml", e.getDocumentName());
        }
    }

    @Test
    public void testDuplicateClassAcrossDocuments() throws Exception {
        File dir = folder.newFolder("duplicate");
        byte[] wish = Files.readAllBytes(new File(vnDir, "wish-62.xml").toPath());
        Files.write(new File(dir, "wish-62.xml").toPath(), wish);
        Files.write(new File(dir, "wish-62-copy.xml").toPath(), wish);
        try {
            VerbNet.load(dir);
            fail("duplicate class accepted");
        } catch (CorpusIntegrityException e) {
            assertTrue(e.getMessage().contains("wish-62"));
        }
    }

    @Test
    public void testProperties() throws Exception {
        Properties props = new Properties();
        props.setProperty("dir", vnDir.getPath());
        props.setProperty("threads", "2");
        props.setProperty("timeout", "5");
        props.setProperty("strict_frames", "true");

        VNCorpusReader reader = new VNCorpusReader(props);
        assertEquals(vnDir, reader.getLocation());
        assertEquals(2, reader.getThreads());
        assertEquals(5, reader.getTimeout());
        assertTrue(reader.getExtractor().isStrictFrames());
        assertEquals(4, reader.read().size());

        assertFalse(new VNCorpusReader(vnDir).getExtractor().isStrictFrames());
    }

    @Test
    public void testStrictFramesProperty() throws Exception {
        File dir = folder.newFolder("strict");
        write(new File(dir, "dup-1.xml"),
                "<VNCLASS ID=\"dup-1\"><MEMBERS><MEMBER name=\"x\"/></MEMBERS><FRAMES>"+
                "<FRAME><DESCRIPTION primary=\"NP V\"/></FRAME>"+
                "<FRAME><DESCRIPTION primary=\"NP V\"/></FRAME>"+
                "</FRAMES></VNCLASS>");

        Properties props = new Properties();
        props.setProperty("dir", dir.getPath());
        assertEquals(1, new VNCorpusReader(props).read().get(0).getFrames().size());

        props.setProperty("strict_frames", "true");
        try {
            new VNCorpusReader(props).read();
            fail("duplicate frame accepted in strict mode");
        } catch (CorpusIntegrityException e) {
            assertEquals("dup-1.xml", e.getDocumentName());
        }
    }

    @Test(expected=VerbNetException.class)
    public void testInvalidTimeout() throws Exception {
        Properties props = new Properties();
        props.setProperty("dir", vnDir.getPath());
        props.setProperty("timeout", "soon");
        new VNCorpusReader(props);
    }

    @Test
    public void testNonPositiveTimeout() throws Exception {
        Properties props = new Properties();
        props.setProperty("dir", vnDir.getPath());
        for (String timeout:new String[]{"0", "-5"}) {
            props.setProperty("timeout", timeout);
            try {
                new VNCorpusReader(props);
                fail("timeout "+timeout+" accepted");
            } catch (VerbNetException e) {
                assertTrue(e.getMessage().contains(timeout));
            }
        }
        try {
            new VNCorpusReader(vnDir).setTimeout(0);
            fail("timeout 0 accepted");
        } catch (IllegalArgumentException e) {
        }
    }

    @Test
    public void testTimeout() throws Exception {
        VNCorpusReader reader = new VNCorpusReader(vnDir);
        reader.setThreads(1);
        reader.setTimeout(1);
        reader.setExtractor(new VNClassExtractor() {
            @Override
            public List<VNClass> extractClasses(XMLNode root, String documentName) throws CorpusIntegrityException {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.extractClasses(root, documentName);
            }
        });

        long start = System.currentTimeMillis();
        try {
            reader.read();
            fail("slow document did not time out");
        } catch (VerbNetException e) {
            assertEquals("want-32.1.xml", e.getDocumentName());
            assertTrue(e.getMessage().contains("timed out after 1 seconds"));
        }
        assertTrue(System.currentTimeMillis()-start<4000);
    }

    @Test
    public void testParseThreadCount() {
        assertEquals(3, VNCorpusReader.parseThreadCount("3"));
        assertEquals(VNCorpusReader.MAX_THREADS, VNCorpusReader.parseThreadCount("1000"));
        int auto = VNCorpusReader.parseThreadCount("auto");
        assertTrue(auto>0 && auto<=VNCorpusReader.MAX_THREADS);
        assertTrue(VNCorpusReader.parseThreadCount("many")>0);
        assertTrue(VNCorpusReader.parseThreadCount("0")>0);
    }
}
