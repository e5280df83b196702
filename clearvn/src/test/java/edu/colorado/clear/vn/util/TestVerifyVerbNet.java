package edu.colorado.clear.vn.util;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import edu.colorado.clear.vn.VNFrameMatch;
import edu.colorado.clear.vn.VerbNet;
import gnu.trove.map.TObjectIntMap;

public class TestVerifyVerbNet {

    VerbNet verbNet;

    @Before
    public void setUp() throws Exception {
        verbNet = VerbNet.load(new File(TestVerifyVerbNet.class.getResource("/verbnet").toURI()));
    }

    @Test
    public void testCountPatterns() {
        TObjectIntMap<String> patternCnt = VerifyVerbNet.countPatterns(verbNet);
        assertEquals(3, patternCnt.size());
        assertEquals(3, patternCnt.get("NP V NP"));
        assertEquals(2, patternCnt.get("NP V PP.theme"));
        assertEquals(1, patternCnt.get("NP V that S"));

        assertEquals(Arrays.asList("NP V NP", "NP V PP.theme", "NP V that S"), VerifyVerbNet.topPatterns(patternCnt, 10));
        assertEquals(Arrays.asList("NP V NP"), VerifyVerbNet.topPatterns(patternCnt, 1));
    }

    @Test
    public void testPrintStats() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        VerifyVerbNet.printStats(verbNet, 2, out);

        String[] lines = bytes.toString("UTF-8").split("\n");
        assertEquals(4, lines.length);
        assertEquals("4 classes, 9 members, 6 frames", lines[0]);
        assertEquals("3 distinct primary patterns", lines[1]);
        assertEquals("     3 NP V NP", lines[2]);
        assertEquals("     2 NP V PP.theme", lines[3]);
    }

    @Test
    public void testPrintMatches() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        VerifyVerbNet.printMatches(verbNet.findFrames("NP V NP", "dream"), out);
        VerifyVerbNet.printMatches(Collections.<VNFrameMatch>emptyList(), out);

        String[] lines = bytes.toString("UTF-8").split("\\r?\\n");
        assertEquals(5, lines.length);
        assertTrue(lines[0].startsWith("want-32.1-1 "));
        assertEquals("    Dorothy craved the apple.", lines[1]);
        assertTrue(lines[2].startsWith("wish-62 "));
        assertEquals("    I wished it.", lines[3]);
        assertEquals("no match", lines[4]);
    }
}
