package polyopt.polyhedral.extract;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import polyopt.AST.ASTBuilder;
import polyopt.AST.Program;
import polyopt.Util.error.ParserErrorListener;
import polyopt.Util.error.ToolkitFailure;
import polyopt.parser.LoopLexer;
import polyopt.parser.LoopParser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the scop regions of a source file and the parameter values it
 * declares.
 */
public class Extractor {
    private static final Logger logger = LoggerFactory.getLogger(Extractor.class);

    private static final Pattern scopPragma = Pattern.compile("\\s*#\\s*pragma\\s+scop\\s*");
    private static final Pattern endscopPragma = Pattern.compile("\\s*#\\s*pragma\\s+endscop\\s*");
    private static final Pattern define = Pattern.compile(
            "^[ \\t]*#[ \\t]*define[ \\t]+([A-Za-z_]\\w*)[ \\t]+\\(?[ \\t]*(-?\\d+)[ \\t]*\\)?[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern declaration = Pattern.compile(
            "^[ \\t]*(?:static[ \\t]+)?(?:const[ \\t]+)?(?:int|long)[ \\t]+([A-Za-z_]\\w*)[ \\t]*=[ \\t]*(-?\\d+)[ \\t]*;",
            Pattern.MULTILINE);

    public static List<ScopSource> regions(String text) {
        List<ScopSource> result = new ArrayList<>();
        int offset = 0;
        int line = 1;
        int bodyStart = -1;
        int bodyLine = 0;
        String indent = "";
        while (offset < text.length()) {
            int newline = text.indexOf('\n', offset);
            int lineEnd = newline == -1 ? text.length() : newline;
            int next = newline == -1 ? text.length() : newline + 1;
            String content = text.substring(offset, lineEnd);
            if (content.endsWith("\r")) {
                content = content.substring(0, content.length() - 1);
            }
            if (scopPragma.matcher(content).matches()) {
                if (bodyStart != -1) {
                    throw new ToolkitFailure("line " + line + ": nested #pragma scop");
                }
                bodyStart = next;
                bodyLine = line + 1;
                indent = content.substring(0, content.indexOf('#'));
            } else if (endscopPragma.matcher(content).matches()) {
                if (bodyStart == -1) {
                    throw new ToolkitFailure("line " + line + ": #pragma endscop without #pragma scop");
                }
                result.add(new ScopSource(result.size(), text.substring(bodyStart, offset), bodyStart, offset, bodyLine, indent));
                bodyStart = -1;
            }
            offset = next;
            ++line;
        }
        if (bodyStart != -1) {
            throw new ToolkitFailure("line " + (bodyLine - 1) + ": #pragma scop without #pragma endscop");
        }
        logger.debug("found {} scop regions", result.size());
        return result;
    }

    /**
     * Values from {@code #define NAME value} and {@code [const] int|long NAME = value;}
     * lines. A #define wins over a declaration of the same name.
     */
    public static HashMap<String, Long> parameterValues(String text) {
        HashMap<String, Long> result = new HashMap<>();
        for (Pattern pattern : List.of(declaration, define)) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                result.put(matcher.group(1), Long.parseLong(matcher.group(2)));
            }
        }
        return result;
    }

    public static Program parse(ScopSource source) {
        try {
            LoopLexer lexer = new LoopLexer(CharStreams.fromString(source.text));
            lexer.removeErrorListeners();
            lexer.addErrorListener(new ParserErrorListener());
            LoopParser parser = new LoopParser(new CommonTokenStream(lexer));
            parser.removeErrorListeners();
            parser.addErrorListener(new ParserErrorListener());
            return (Program) new ASTBuilder().visit(parser.scop());
        } catch (ToolkitFailure e) {
            throw new ToolkitFailure("scop " + source.index + " (line " + source.firstLine + "): " + e.getMessage(), e);
        }
    }
}
