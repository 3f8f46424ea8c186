package DFAMin;

import DFAMin.Model.DFAModel;
import DFAMin.Trace.MinimizationTrace;
import DFAMin.Validation.DFAValidator;
import DFAMin.Validation.Diagnostic;
import DFAMin.Validation.ValidationResult;
import net.automatalib.exception.FormatException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class DFAMinCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  /**
   * Parse, validate and minimize one DFA file.
   * @param args - command-line arguments
   * @param out - progress and result output
   * @param err - usage and failure output
   * @return exit status
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    String baFilename = null;
    String dotFilename = null;
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // only effective before the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      } else if ("--writeBA".equalsIgnoreCase(arg) || "--writeDOT".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          err.println("Missing value for " + arg);
          return printUsage(err);
        }
        if ("--writeBA".equalsIgnoreCase(arg)) {
          baFilename = args[++i];
        } else {
          dotFilename = args[++i];
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        return printUsage(err);
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 1) {
      return printUsage(err);
    }
    String filePath = positional.get(0);

    out.println("[1] Reading DFA file: " + filePath);
    final DFAModel dfa;
    try {
      dfa = DFATextFormat.read(Paths.get(filePath)).dfa();
    } catch (IOException | FormatException e) {
      err.println("FATAL: could not read DFA file: " + e.getMessage());
      return EXIT_FAILED;
    }
    out.println("Original DFA size: " + dfa.size());
    out.println("Alphabet size: " + dfa.getAlphabet().size());

    out.println();
    out.println("[2] Validating DFA...");
    ValidationResult validation = DFAValidator.validate(dfa);
    for (Diagnostic d : validation.diagnostics()) {
      out.println("    - " + d);
    }
    if (!validation.valid()) {
      err.println("FATAL: the DFA is invalid (validation reported errors). Cannot minimize.");
      return EXIT_FAILED;
    }
    out.println(validation.warnings().isEmpty() ? "Validation OK." : "Validation OK (with warnings).");

    out.println();
    out.println("[3] Minimizing DFA...");
    MinimizationTrace trace = new MinimizationTrace();
    TableFillingMinimizer.minimize(dfa, trace.andThen(out::println));
    if (!trace.isSuccessful()) {
      err.println("FATAL: minimization failed: " + trace.getError().map(e -> e.message()).orElse("no result"));
      return EXIT_FAILED;
    }
    DFAModel minimized = trace.requireResult();
    out.println("Minimized DFA size: " + minimized.size());

    if (baFilename != null) {
      out.println("Writing BA file: " + baFilename);
      CompactConversion.writeBAFile(baFilename, minimized);
    }
    if (dotFilename != null) {
      out.println("Writing DOT file: " + dotFilename);
      DOTFormat.writeDOTFile(dotFilename, minimized);
    }
    return EXIT_OK;
  }

  private static int printUsage(PrintStream err) {
    err.println("DFAMin [--debug] [--writeBA <BA output file>] [--writeDOT <DOT output file>] <DFA file>");
    err.println("[--debug] : Additional debug/progress output");
    err.println("[--writeBA <BA output file>] : Write the minimized DFA in BA format");
    err.println("[--writeDOT <DOT output file>] : Write the minimized DFA as a Graphviz diagram source");
    err.println();
    err.println("<DFA file> : DFA description with 'alphabet:', 'states:', 'initial:', 'final:' lines");
    err.println("  followed by a 'transitions' section of 'origin, destination, symbol' lines.");
    return EXIT_USAGE;
  }
}
