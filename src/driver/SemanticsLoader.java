package driver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Z3Exception;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import lift.Formulas;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Reads semantics files. A file is a sequence of blocks:
 *
 * <pre>
 * #intrinsic _mm_add_epi32 32
 * (declare-fun a () (_ BitVec 128))
 * ...
 * (assert (= (concat ...) #x00000000000000000000000000000000))
 * </pre>
 *
 * The block body is SMT-LIB2; the formula is the left side of the equality
 * in the first assertion. Without a lane width the whole result is one lane.
 * Blank lines and {@code ;} comments outside blocks are ignored.
 */
public class SemanticsLoader {
    private static final Logger log = LoggingManager.getLogger(SemanticsLoader.class);

    public static final String HEADER = "#intrinsic";

    private final Context ctx;

    public SemanticsLoader(Context ctx) {
        this.ctx = ctx;
    }

    public List<InstructionSemantics> loadFromFile(Path path) throws IOException, SemanticsFormatException {
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + path);
        }
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public List<InstructionSemantics> parse(List<String> lines) throws SemanticsFormatException {
        List<InstructionSemantics> out = new ArrayList<>();
        String header = null;
        int headerLine = -1;
        StringBuilder body = new StringBuilder();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.trim();
            int lineNumber = i + 1;
            if (trimmed.startsWith(HEADER)) {
                if (header != null) {
                    out.add(parseBlock(header, headerLine, body.toString()));
                }
                header = trimmed;
                headerLine = lineNumber;
                body.setLength(0);
            } else if (header != null) {
                body.append(line).append('\n');
            } else if (!trimmed.isEmpty() && !trimmed.startsWith(";")) {
                throw SemanticsFormatException.strayText(lineNumber, line);
            }
        }
        if (header != null) {
            out.add(parseBlock(header, headerLine, body.toString()));
        }
        log.debug("loaded {} instruction(s)", out.size());
        return out;
    }

    private InstructionSemantics parseBlock(String header, int headerLine, String body)
            throws SemanticsFormatException {
        String[] parts = header.split("\\s+");
        if (parts.length < 2 || parts.length > 3 || !parts[0].equals(HEADER)) {
            throw SemanticsFormatException.badHeader("expected '#intrinsic <name> [laneWidth]'", headerLine, header);
        }
        String name = parts[1];

        BoolExpr[] assertions;
        try {
            assertions = ctx.parseSMTLIB2String(body, null, null, null, null);
        } catch (Z3Exception e) {
            throw new SemanticsFormatException("Bad SMT-LIB2 for " + name + ": " + e.getMessage(),
                    headerLine, header, e);
        }
        if (assertions.length == 0) {
            throw SemanticsFormatException.badFormula("no assertion for " + name, headerLine, header);
        }
        Expr<?> first = assertions[0];
        if (!Formulas.isAppOf(first, Z3_decl_kind.Z3_OP_EQ) || first.getNumArgs() != 2) {
            throw SemanticsFormatException.badFormula("first assertion of " + name + " is not an equality",
                    headerLine, header);
        }
        Expr<?> formula = first.getArgs()[0];

        int laneWidth = Formulas.widthOf(formula);
        if (parts.length == 3) {
            try {
                laneWidth = Integer.parseInt(parts[2]);
            } catch (NumberFormatException e) {
                throw SemanticsFormatException.badHeader("lane width is not a number", headerLine, header);
            }
            if (laneWidth <= 0) {
                throw SemanticsFormatException.badHeader("lane width must be positive", headerLine, header);
            }
        }
        return new InstructionSemantics(name, laneWidth, formula, headerLine);
    }
}
