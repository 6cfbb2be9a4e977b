package ch.so.agi.scs;

import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.agi.scs.model.ScgGraph;
import ch.so.agi.scs.model.ScgModelException;

/**
 * Reads a JSON element model from stdin and prints its SCs text to stdout. An optional first
 * argument carries the settings as JSON.
 */
public class Scg2ScsLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(Scg2ScsLauncher.class);

    public static void main(String[] args) {
        Reader in = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.exit(run(args, in, out));
    }

    static int run(String[] args, Reader in, PrintStream out) {
        ScsWriterSettings settings = args != null && args.length > 0
                ? ScsWriterSettings.from(args[0])
                : new ScsWriterSettings();
        LOG.info("Converting with {}", settings);
        try {
            ScgGraph graph = ScgGraphReader.read(in);
            out.print(Scg2Scs.render(graph, settings));
            out.flush();
            return 0;
        } catch (ScgModelException e) {
            LOG.error("Conversion failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
