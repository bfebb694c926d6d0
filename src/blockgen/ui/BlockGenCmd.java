package blockgen.ui;

import blockgen.BlockGen;
import blockgen.blocks.UnsupportedBlockTypeException;
import blockgen.codegen.IntegrationMethod;
import blockgen.expr.ExpressionSyntaxException;
import blockgen.expr.ExpressionValidationException;
import blockgen.frontend.ModelFormatException;
import blockgen.frontend.ModelReader;
import blockgen.frontend.ModelReader.LoadedModel;
import java.io.File;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class BlockGenCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("blockgencmd - flatten a block diagram model and generate standalone C code", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("m")
                          .longOpt("model")
                          .argName("model.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML or JSON file with the sheets of the model")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to write <model>.h, <model>.c and manifest.yaml to; 'generated' by default")
                          .build());
    options.addOption(Option.builder("n")
                          .longOpt("name")
                          .argName("model name")
                          .hasArg()
                          .required(false)
                          .desc("Model name used for file names and C symbols; defaults to the name in the model file")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("max-depth")
                          .argName("depth")
                          .hasArg()
                          .required(false)
                          .desc("Maximum subsystem nesting depth, " + new BlockGenConfig().maxNestingDepth + " by default")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("integration")
                          .argName("method")
                          .hasArg()
                          .required(false)
                          .desc("Integration method of the generated step function, one of "
                                + Arrays.stream(IntegrationMethod.values()).map(method -> method.serialName).collect(Collectors.joining(", "))
                                + "; " + IntegrationMethod.RK4.serialName + " by default")
                          .build());
    options.addOption(Option.builder("W").longOpt("werror").required(false).desc("Treat modeling warnings as errors").build());
    options.addOption(Option.builder().longOpt("no-manifest").required(false).desc("Do not write manifest.yaml").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    // help must work without the required options
    for (String arg : args) {
      if (arg.equals("-h") || arg.equals("--help"))
        printHelpAndExit(options);
    }

    //////////   collect options   //////////
    BlockGenConfig config = new BlockGenConfig();
    String modelFileName = "";
    String modelName = null;
    String outputDir = "";
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      modelFileName = line.getOptionValue("m");
      modelName = line.getOptionValue("n");
      outputDir = line.hasOption("o") ? line.getOptionValue("o") : "generated";
      if (line.hasOption("max-depth"))
        config.maxNestingDepth = Integer.parseInt(line.getOptionValue("max-depth"));
      if (line.hasOption("integration")) {
        String methodName = line.getOptionValue("integration");
        config.integrationMethod = IntegrationMethod.fromSerialName(methodName)
                                       .orElseThrow(() -> new ParseException("Unknown integration method '" + methodName + "'"));
      }
      config.warningsAsErrors = line.hasOption("W");
      config.writeManifest = !line.hasOption("no-manifest");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException | NumberFormatException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    //////////   read the model and generate   //////////
    boolean success;
    try {
      LoadedModel model = new ModelReader().ReadModel(new File(modelFileName));
      config.modelName = (modelName != null) ? modelName : model.name();
      success = new BlockGen(config).Generate(model.sheets(), outputDir);
    } catch (ModelFormatException | UnsupportedBlockTypeException | ExpressionSyntaxException | ExpressionValidationException e) {
      logger.error(e.getMessage());
      success = false;
    } catch (IllegalArgumentException e) {
      logger.error("Invalid model: {}", e.getMessage());
      success = false;
    }

    System.exit(success ? 0 : 1);
  }
}
