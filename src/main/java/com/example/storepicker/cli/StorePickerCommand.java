package com.example.storepicker.cli;

import com.example.storepicker.SamplingConfigurationException;
import com.example.storepicker.StratifiedSampler;
import com.example.storepicker.io.UnitTableReader;
import com.example.storepicker.io.UnitTableWriter;
import com.example.storepicker.model.UnitRecord;
import com.example.storepicker.model.UnitTable;
import com.example.storepicker.report.SampleSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Stratified sampler: CSV in, stratified CSV sample out, distribution summary on stdout.
 */
@CommandLine.Command(name = "store-picker",
    mixinStandardHelpOptions = true,
    description = "Stratified sampler: CSV in -> stratified CSV sample out.")
public class StorePickerCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(StorePickerCommand.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    static final String DEFAULT_ID_COL = "Store_ID";
    static final long DEFAULT_SEED = 42L;
    static final List<String> DEFAULT_STRAT_COLS =
        List.of("Country", "Region", "Store_Format", "Store_Type", "Category");

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT_CSV", description = "Input CSV file path")
    private Path inputCsv;

    @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT_CSV", description = "Output CSV file path")
    private Path outputCsv;

    @CommandLine.Option(names = "--target-n", required = true,
        description = "Total sample size you want (e.g. 160).")
    private int targetN;

    @CommandLine.Option(names = "--id-col", defaultValue = DEFAULT_ID_COL,
        description = "Unique ID column name (default: ${DEFAULT-VALUE}).")
    private String idCol = DEFAULT_ID_COL;

    @CommandLine.Option(names = "--strat-cols", arity = "1..*",
        description = "Stratification columns, space separated (default: "
            + "Country Region Store_Format Store_Type Category).")
    private List<String> stratCols;

    @CommandLine.Option(names = "--seed", defaultValue = "" + DEFAULT_SEED,
        description = "Random seed (default: ${DEFAULT-VALUE}).")
    private long seed = DEFAULT_SEED;

    @CommandLine.Option(names = "--min-per-stratum", defaultValue = "1",
        description = "Minimum units per stratum (default: ${DEFAULT-VALUE}).")
    private int minPerStratum = 1;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new StorePickerCommand()).execute(args));
    }

    private void validateOptions() {
        if (targetN < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --target-n must not be negative");
        }
        if (minPerStratum < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --min-per-stratum must not be negative");
        }
    }

    @Override
    public Integer call() {
        validateOptions();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<String> columns = stratCols == null ? DEFAULT_STRAT_COLS : stratCols;

        try {
            UnitTable table = new UnitTableReader().read(inputCsv);
            out.println("Loaded " + table.size() + " rows from " + inputCsv);

            List<UnitRecord> selected = new StratifiedSampler()
                .sample(table, idCol, columns, targetN, seed, minPerStratum);

            new UnitTableWriter().write(outputCsv, table.headers(), selected);
            out.println();
            out.println("Saved " + selected.size() + " rows to " + outputCsv);

            SampleSummary.of(selected, table.headers(), columns).print(out);
            return EXIT_SUCCESS;
        } catch (SamplingConfigurationException e) {
            logger.error("Invalid sampling configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            logger.error("I/O failure: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        } finally {
            out.flush();
            err.flush();
        }
    }
}
