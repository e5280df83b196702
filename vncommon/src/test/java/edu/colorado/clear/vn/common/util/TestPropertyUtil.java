package edu.colorado.clear.vn.common.util;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestPropertyUtil {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    Properties props;

    @Before
    public void setUp() throws Exception {
        props = new Properties();
        props.setProperty("verbnet.dir", "/data/verbnet");
        props.setProperty("verbnet.threads", "4");
        props.setProperty("threads", "2");
        props.setProperty("logger.level", "FINE");
    }

    @Test
    public void testFilterProperties() {
        Properties out = PropertyUtil.filterProperties(props, "verbnet.");
        assertEquals(2, out.size());
        assertEquals("/data/verbnet", out.getProperty("dir"));
        assertEquals("4", out.getProperty("threads"));

        out = PropertyUtil.filterProperties(props, "verbnet.", true);
        assertEquals(3, out.size());
        // filtered value wins over the inherited one
        assertEquals("4", out.getProperty("threads"));
        assertEquals("FINE", out.getProperty("logger.level"));
    }

    @Test
    public void testResolveEnvironmentVariables() {
        Properties in = new Properties();
        in.setProperty("plain", "verbnet-3.2");
        in.setProperty("missing", "${CLEARVN_SURELY_UNDEFINED_VARIABLE}/verbnet");

        Properties out = PropertyUtil.resolveEnvironmentVariables(in);
        assertEquals("verbnet-3.2", out.getProperty("plain"));
        assertEquals("/verbnet", out.getProperty("missing"));
    }

    @Test
    public void testLoad() throws Exception {
        File file = folder.newFile("verbnet.properties");
        Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8);
        writer.write("verbnet.dir = ${CLEARVN_SURELY_UNDEFINED_VARIABLE}/data/verbnet\n");
        writer.write("verbnet.timeout = 30\n");
        writer.close();

        Properties loaded = PropertyUtil.load(file);
        assertEquals("/data/verbnet", loaded.getProperty("verbnet.dir"));
        assertEquals("30", loaded.getProperty("verbnet.timeout"));
    }

    @Test
    public void testToString() {
        Properties in = new Properties();
        in.setProperty("b", "2");
        in.setProperty("a", "1");
        assertEquals("a = 1\nb = 2\n", PropertyUtil.toString(in));
    }
}
