import java.io.IOException;

import driver.*;
import exception.LiftException;
import util.logging.LogManager;

public class Lift {
    /*
     * move the duty of lifter to driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        LifterDriver driver = LifterDriver.getInstance();
        int status = 0;
        try {
            driver.parseArgs(args);
            driver.run();
        } catch (LiftException e) {
            System.err.println("lift: " + e.getMessage());
            status = 1;
        } catch (SemanticsFormatException e) {
            String where = e.getLineNumber() >= 0 ? ":" + e.getLineNumber() : "";
            System.err.println("lift: " + driver.getSource() + where + ": " + e.getMessage());
            status = 2;
        } catch (IOException e) {
            System.err.println("lift: cannot read " + driver.getSource() + ": " + e.getMessage());
            status = 2;
        }
        // flush the log file before leaving
        LogManager.shutdown();
        if (status != 0) {
            System.exit(status);
        }
    }
}
