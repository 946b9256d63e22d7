package driver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import com.microsoft.z3.Context;

import exception.LiftException;
import exception.UnsupportedFormulaException;
import lift.LiftResult;
import lift.Lifter;
import pass.PassManager;
import util.LoggingManager;
import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.Logger;

public class LifterDriver {
    private static LifterDriver lifterDriver = new LifterDriver();
    private static final Logger logger = LoggingManager.getLogger(LifterDriver.class);

    private String source = null;
    private String target = null;
    // 当前正在提升的指令名，日志前缀用
    private String currentInstruction = null;

    public record Summary(int lifted, int unsupported) {
        @Override
        public String toString() {
            return "; lifted " + lifted + ", unsupported " + unsupported;
        }
    }

    private LifterDriver() {
    }

    public static LifterDriver getInstance() {
        return lifterDriver;
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws LiftException {
        if (args == null || args.length == 0) {
            throw LiftException.noArgs();
        }
        source = null;
        target = null;
        var cmds = Arrays.asList(args);
        var iter = cmds.iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        target = iter.next();
                    } else {
                        throw LiftException.wrongArgs("Need arg after -o bug got: " + cmd);
                    }
                }
                case "-O0" -> {
                    Config.getInstance().isO1 = false;
                    PassManager.resetInstance();
                }
                case "-O1" -> {
                    Config.getInstance().isO1 = true;
                    PassManager.resetInstance();
                }
                case "-check" -> {
                    if (!iter.hasNext()) {
                        throw LiftException.wrongArgs("Need sample count after -check");
                    }
                    String n = iter.next();
                    try {
                        Config.getInstance().checkSamples = Integer.parseInt(n);
                    } catch (NumberFormatException e) {
                        throw LiftException.wrongArgs("-check " + n);
                    }
                    PassManager.resetInstance();
                }
                case "-debug" -> {
                    Config.getInstance().isDebug = true;
                    LogManager.setRootLevel(LogLevel.DEBUG);
                    LogManager.enableConsole();
                }
                default -> {
                    if (!cmd.startsWith("-") && source == null) {
                        source = cmd;
                    } else {
                        throw LiftException.wrongArgs(cmd);
                    }
                }
            }
        }
        if (source == null) {
            throw LiftException.wrongArgs("no semantics file given");
        }
    }

    /*
     * real driver: lift every instruction of the source file, one translator
     * each, on a shared Z3 context
     */
    public Summary run() throws IOException, SemanticsFormatException {
        if (source == null) {
            throw LiftException.noArgs();
        }

        int lifted = 0;
        int unsupported = 0;
        StringBuilder out = new StringBuilder();
        try (Context ctx = new Context()) {
            List<InstructionSemantics> semantics = new SemanticsLoader(ctx).loadFromFile(Path.of(source));
            Lifter lifter = new Lifter(ctx);
            for (InstructionSemantics sema : semantics) {
                currentInstruction = sema.name();
                try {
                    LiftResult result = lifter.lift(sema.formula(), sema.laneWidth());
                    out.append("; ").append(sema.name()).append('\n').append(result.toIR()).append('\n');
                    lifted++;
                    logger.info("lifted {}: {} lane(s), {} node(s)",
                            sema.name(), result.laneCount(), result.dag().size());
                } catch (UnsupportedFormulaException e) {
                    unsupported++;
                    logger.warn("skipping {}: {}", sema.name(), e.getMessage());
                } catch (LiftException e) {
                    logger.error("failed to lift " + sema.name(), e);
                    throw e;
                } finally {
                    currentInstruction = null;
                }
            }
        }

        Summary summary = new Summary(lifted, unsupported);
        out.append(summary).append('\n');
        if (target != null) {
            Files.writeString(Path.of(target), out.toString(), StandardCharsets.UTF_8);
        } else {
            System.out.print(out);
        }
        logger.info("{} lifted, {} unsupported", lifted, unsupported);
        return summary;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getCurrentInstruction() {
        return currentInstruction;
    }
}
