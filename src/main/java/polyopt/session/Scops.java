package polyopt.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import polyopt.Util.config.Configuration;
import polyopt.Util.error.NavigationError;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.extract.Extractor;
import polyopt.polyhedral.extract.ScopSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * The scops of one source file. A scop that cannot be analysed is kept
 * with its failure and printed back unchanged; the others are unaffected.
 */
public class Scops implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Scops.class);

    private String text;
    private HashMap<String, Long> sourceParams;
    private final List<Scop> scops;
    private boolean closed;

    private Scops(String text_, Configuration config) {
        text = text_;
        sourceParams = Extractor.parameterValues(text);
        scops = new ArrayList<>();
        for (ScopSource source : Extractor.regions(text)) {
            scops.add(new Scop(source, config, sourceParams));
        }
        logger.info("{} scops opened", scops.size());
    }

    public static Scops open(Path path, Configuration config) {
        try {
            return new Scops(Files.readString(path, StandardCharsets.UTF_8), config);
        } catch (IOException e) {
            throw new ToolkitFailure("cannot read " + path, e);
        }
    }

    public static Scops open(String text, Configuration config) {
        return new Scops(text, config);
    }

    private void check() {
        if (closed) {
            throw new IllegalStateException("scops have been closed");
        }
    }

    public int size() {
        check();
        return scops.size();
    }

    public Scop select(int pos) {
        check();
        if (pos < 0 || pos >= scops.size()) {
            throw new NavigationError("scop " + pos + " out of range, the source has " + scops.size());
        }
        return scops.get(pos);
    }

    /**
     * The source with every modified scop replaced by code generated from its
     * current schedule.
     */
    public String generateCode() {
        return render(new ArrayList<>());
    }

    private String render(List<Scop> rewritten) {
        check();
        StringBuilder sb = new StringBuilder();
        int last = 0;
        for (Scop scop : scops) {
            sb.append(text, last, scop.source.start);
            String code;
            try {
                code = scop.generateCode();
                if (scop.isModified() && scop.failure() == null) {
                    rewritten.add(scop);
                }
            } catch (ToolkitFailure e) {
                logger.error("scop {}: code generation failed, original kept: {}", scop.source.index, e.getMessage());
                code = scop.source.text;
            }
            sb.append(code);
            last = scop.source.end;
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    /**
     * Writes {@link #generateCode()} to {@code outputPath}.
     *
     * @return the number of regions rewritten from their schedule; regions
     * kept as in the source do not count
     * @throws ToolkitFailure if the file cannot be written
     */
    public int generate(String outputPath) {
        List<Scop> rewritten = new ArrayList<>();
        String code = render(rewritten);
        try {
            Files.writeString(Path.of(outputPath), code, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolkitFailure("cannot write " + outputPath, e);
        }
        logger.info("wrote {}: {} of {} scops rewritten", outputPath, rewritten.size(), scops.size());
        return rewritten.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        for (Scop scop : scops) {
            scop.release();
        }
        sourceParams = null;
        text = null;
        closed = true;
    }
}
