package edu.colorado.clear.vn.util;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import edu.colorado.clear.vn.VNClass;
import edu.colorado.clear.vn.VNFrameMatch;
import edu.colorado.clear.vn.VerbNet;
import edu.colorado.clear.vn.VerbNetException;
import edu.colorado.clear.vn.common.util.PropertyUtil;
import gnu.trove.iterator.TObjectIntIterator;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

/**
 * Loads a VerbNet corpus, failing on the first malformed or incomplete
 * document, and prints corpus statistics and optionally one frame lookup.
 */
public class VerifyVerbNet {

    private static Logger logger = Logger.getLogger("clearvn");

    @Option(name="-prop",usage="properties file")
    private File propFile = null;

    @Option(name="-dir",usage="VerbNet directory or zip archive (overrides verbnet.dir)")
    private File vnDir = null;

    @Option(name="-pattern",usage="primary POS pattern to look up, e.g. \"NP V NP\"")
    private String pattern = null;

    @Option(name="-member",usage="member verb to look up")
    private String member = null;

    @Option(name="-top",usage="number of most frequent patterns to print (default 10)")
    private int top = 10;

    @Option(name="-h",usage="help message")
    private boolean help = false;

    /**
     * @return number of frames in the corpus for each primary pattern
     */
    static TObjectIntMap<String> countPatterns(VerbNet verbNet) {
        TObjectIntMap<String> patternCnt = new TObjectIntHashMap<String>();
        for (VNClass vnClass:verbNet.getVerbClasses())
            for (String primary:vnClass.getFrames().keySet())
                patternCnt.adjustOrPutValue(primary, 1, 1);
        return patternCnt;
    }

    /**
     * @return the <code>top</code> most frequent patterns, ties broken by name
     */
    static List<String> topPatterns(final TObjectIntMap<String> patternCnt, int top) {
        List<String> patterns = new ArrayList<String>(patternCnt.size());
        for (TObjectIntIterator<String> iter=patternCnt.iterator(); iter.hasNext();) {
            iter.advance();
            patterns.add(iter.key());
        }
        Collections.sort(patterns, new Comparator<String>() {
            @Override
            public int compare(String lhs, String rhs) {
                int diff = patternCnt.get(rhs)-patternCnt.get(lhs);
                return diff!=0?diff:lhs.compareTo(rhs);
            }
        });
        return patterns.size()>top?patterns.subList(0, top):patterns;
    }

    static void printStats(VerbNet verbNet, int top, PrintStream out) {
        int members = 0;
        int frames = 0;
        for (VNClass vnClass:verbNet.getVerbClasses()) {
            members += vnClass.getMembers().size();
            frames += vnClass.getFrames().size();
        }

        out.printf("%d classes, %d members, %d frames\n", verbNet.size(), members, frames);

        TObjectIntMap<String> patternCnt = countPatterns(verbNet);
        out.printf("%d distinct primary patterns\n", patternCnt.size());
        for (String pattern:topPatterns(patternCnt, top))
            out.printf("%6d %s\n", patternCnt.get(pattern), pattern);
    }

    static void printMatches(List<VNFrameMatch> matches, PrintStream out) {
        if (matches.isEmpty()) {
            out.println("no match");
            return;
        }
        for (VNFrameMatch match:matches) {
            out.println(match.getClassId()+" "+match.getFrame().getDescription());
            for (List<String> example:match.getFrame().getExamples())
                if (!example.isEmpty())
                    out.println("    "+example.get(0));
        }
    }

    public static void main(String[] args) throws Exception {
        VerifyVerbNet options = new VerifyVerbNet();
        CmdLineParser cmdParser = new CmdLineParser(options);

        try {
            cmdParser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println("invalid options:"+e);
            cmdParser.printUsage(System.err);
            System.exit(0);
        }
        if (options.help) {
            cmdParser.printUsage(System.err);
            System.exit(0);
        }

        Properties props = options.propFile==null?new Properties():PropertyUtil.load(options.propFile);
        if (options.vnDir!=null)
            props.setProperty("verbnet.dir", options.vnDir.getPath());
        Properties vnProps = PropertyUtil.filterProperties(props, "verbnet.");

        String logLevel = vnProps.getProperty("logger.level");
        if (logLevel!=null) {
            logger.setUseParentHandlers(false);
            ConsoleHandler ch = new ConsoleHandler();
            ch.setLevel(Level.parse(logLevel));
            logger.addHandler(ch);
            logger.setLevel(Level.parse(logLevel));
        }

        logger.info(PropertyUtil.toString(vnProps));

        VerbNet verbNet;
        try {
            verbNet = VerbNet.load(props);
        } catch (VerbNetException e) {
            logger.severe("VerbNet verification failed: "+e.getMessage());
            System.exit(1);
            return;
        }

        printStats(verbNet, options.top, System.out);

        if (options.pattern!=null && options.member!=null) {
            System.out.println("\n"+options.pattern+" / "+options.member+":");
            printMatches(verbNet.findFrames(Arrays.asList(options.pattern.trim().split("\\s+")), options.member), System.out);
        }
    }
}
