package org.satba;

import org.satba.optionalfeatures.PigeonholeProblem;
import org.satba.support.BooleanConstraint;
import org.satba.support.Literal;
import org.satba.term.Term;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * INTERNALIZZATORE DI ALGEBRA BOOLEANA - Driver da linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file di asserzioni, una per riga (con comandi push / pop)
 * 2. PARSING: grammatica ANTLR → termini
 * 3. INTERNALIZZAZIONE: vincoli di cardinalità, pseudo-booleani e di parità nello store
 * 4. OUTPUT: dump dello store, formule ricostruite e statistiche
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f)
 * - Directory batch (-d): tutti i file .txt della cartella
 * - Generazione istanze (-gen=pigeonhole n)
 *
 * STRUTTURA OUTPUT:
 * - RESULT/: store e formule ricostruite per ogni file
 * - STATS/: statistiche di internalizzazione
 * - PIGEONHOLE/: istanze generate
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String OPT_PARAM = "-opt=";
    private static final String GEN_PARAM = "-gen=";

    /** Cache delle relazioni XOR */
    private static final String OPT_PARITY_CACHE = "x";
    private static final String OPT_ALL = "all";

    private static final String GEN_PIGEONHOLE = "pigeonhole";

    private static final int MIN_PIGEONHOLE_INSTANCES = 1;
    private static final int MAX_PIGEONHOLE_INSTANCES = 100;

    private static final String RESULT_DIR = "RESULT";
    private static final String STATS_DIR = "STATS";
    private static final String INPUT_EXTENSION = ".txt";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO INTERNALIZZATORE DI ALGEBRA BOOLEANA <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            DriverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE <---");
        }
    }

    private static void executeMainPipeline(DriverConfiguration config) throws IOException {
        if (config.isGenerationMode) {
            System.out.println("[I] Modalità: Generazione istanze " + config.generationType);
            generatePigeonholeInstances(config);
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            processSingleFile(new File(config.inputPath), config);
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            processDirectoryBatch(config);
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    /**
     * Carica logging.properties dal classpath.
     */
    private static void configureLogging() {
        try (InputStream configuration = Main.class.getResourceAsStream("/logging.properties")) {
            if (configuration != null) {
                LogManager.getLogManager().readConfiguration(configuration);
            }
        } catch (IOException e) {
            System.out.println("[E] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    private static DriverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region GENERAZIONE ISTANZE

    private static void generatePigeonholeInstances(DriverConfiguration config) throws IOException {
        PigeonholeProblem generator = new PigeonholeProblem();
        generator.setOutputDirectory(config.outputPath);
        generator.generateInstances(config.generationCount);
    }

    //endregion

    //region ELABORAZIONE FILE E DIRECTORY

    /**
     * @return true se il file è stato elaborato senza errori
     */
    private static boolean processSingleFile(File file, DriverConfiguration config) {
        try {
            System.out.println("[I] Elaborazione: " + file.getPath());
            AssertionFileProcessor.ProcessingReport report =
                    new AssertionFileProcessor(config.useParityCache).process(file.toPath());
            String baseName = getBaseFileName(file.getPath());
            saveResult(report, config, baseName);
            saveStatistics(report, config, baseName);

            System.out.println("[I] Vincoli memorizzati: " + report.store().getConstraintCount()
                    + ", clausole: " + report.store().getClauseCount()
                    + ", rifiutate: " + report.rejectedLines().size());
            return true;
        } catch (Exception e) {
            handleFileProcessingError(file.getPath(), e);
            return false;
        }
    }

    private static void processDirectoryBatch(DriverConfiguration config) throws IOException {
        List<File> files = findAllTxtFiles(config.inputPath);
        if (files.isEmpty()) {
            System.out.println("[I] Nessun file " + INPUT_EXTENSION + " trovato in " + config.inputPath);
            return;
        }

        int successCount = 0;
        for (File file : files) {
            if (processSingleFile(file, config)) {
                successCount++;
            }
        }
        System.out.println("[I] Batch completato: " + successCount + "/" + files.size() + " file elaborati, "
                + (files.size() - successCount) + " errori");
    }

    private static List<File> findAllTxtFiles(String dirPath) throws IOException {
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.toString().toLowerCase().endsWith(INPUT_EXTENSION))
                    .sorted()
                    .map(Path::toFile)
                    .collect(Collectors.toList());
        }
    }

    private static void handleFileProcessingError(String filePath, Exception e) {
        LOGGER.log(Level.WARNING, "Elaborazione fallita per " + filePath, e);
        System.out.println("[E] Errore elaborazione del file '" + filePath + "': " + e.getMessage());
    }

    //endregion

    //region SALVATAGGIO RISULTATI

    private static void saveResult(AssertionFileProcessor.ProcessingReport report, DriverConfiguration config,
                                   String baseName) throws IOException {
        Path directory = getOutputDirectory(config, RESULT_DIR);
        Files.createDirectories(directory);

        try (FileWriter writer = new FileWriter(directory.resolve(baseName + ".txt").toFile())) {
            writer.write(report.store().toString() + "\n\n");

            writer.write("VINCOLI:\n");
            List<BooleanConstraint> constraints = report.store().getConstraints();
            List<Term> formulas = report.formulas();
            for (int i = 0; i < constraints.size(); i++) {
                writer.write("  " + constraints.get(i) + "\n");
                writer.write("    = " + formulas.get(i) + "\n");
            }

            writer.write("\nCLAUSOLE:\n");
            for (List<Literal> clause : report.store().getClauses()) {
                StringBuilder dimacs = new StringBuilder();
                for (Literal literal : clause) {
                    dimacs.append(literal.toDimacs()).append(' ');
                }
                writer.write("  " + clause + "    (" + dimacs + "0)\n");
            }

            writer.write("\nVARIABILI:\n");
            for (var entry : report.store().getVariableMapping().entrySet()) {
                writer.write("  " + entry.getKey() + " = b" + entry.getValue() + "\n");
            }

            if (!report.rejectedLines().isEmpty()) {
                writer.write("\nASSERZIONI RIFIUTATE:\n");
                for (String rejected : report.rejectedLines()) {
                    writer.write("  " + rejected + "\n");
                }
            }
        }
    }

    private static void saveStatistics(AssertionFileProcessor.ProcessingReport report, DriverConfiguration config,
                                       String baseName) throws IOException {
        Path directory = getOutputDirectory(config, STATS_DIR);
        Files.createDirectories(directory);

        try (FileWriter writer = new FileWriter(directory.resolve(baseName + "_stats.txt").toFile())) {
            writer.write(report.statistics().toString());
            if (report.parityCache() != null) {
                writer.write("    Relazioni XOR:          " + report.parityCache().size()
                        + " (ripetute: " + report.parityCache().getDuplicateCount() + ")\n");
            }
        }
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    private static Path getOutputDirectory(DriverConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path inputPath = Paths.get(config.inputPath);
        Path parentDir = config.isFileMode ? inputPath.getParent() : inputPath;
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("UTILIZZO:");
        System.out.println("  java -jar satba-internalizer.jar [opzioni]");
        System.out.println();
        System.out.println("OPZIONI:");
        System.out.println("  -h                     Mostra questo help");
        System.out.println("  -f <file>              Elabora un file di asserzioni");
        System.out.println("  -d <directory>         Elabora tutti i file .txt della directory");
        System.out.println("  -o <directory>         Directory di output (default: accanto all'input)");
        System.out.println("  -opt=x                 Attiva la cache delle relazioni XOR");
        System.out.println("  -opt=all               Attiva tutte le opzioni");
        System.out.println("  -gen=pigeonhole <n>    Genera n istanze pigeonhole in PIGEONHOLE/ (richiede -o)");
        System.out.println();
        System.out.println("FORMATO INPUT (una asserzione per riga):");
        System.out.println("  atleast(2: a, b, c)");
        System.out.println("  atmost(1: a, !b)");
        System.out.println("  exactly(1: a, b)");
        System.out.println("  pb(2 x1 + 3 x2 >= 4)");
        System.out.println("  a <-> b <-> c");
        System.out.println("  push / pop             apre / chiude uno scope");
        System.out.println("  # commento");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata del driver, immutabile.
     */
    private static class DriverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final boolean useParityCache;
        final boolean isGenerationMode;
        final String generationType;
        final int generationCount;

        DriverConfiguration(String inputPath, String outputPath, boolean isFileMode, boolean useParityCache,
                            boolean isGenerationMode, String generationType, int generationCount) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.useParityCache = useParityCache;
            this.isGenerationMode = isGenerationMode;
            this.generationType = generationType;
            this.generationCount = generationCount;
        }
    }

    /**
     * Parser dei parametri da linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se parametri invalidi
         */
        public DriverConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean isGenerationMode = false;
            boolean useParityCache = false;
            String generationType = null;
            int generationCount = 0;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, isGenerationMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, isGenerationMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            useParityCache = parseOptionalFlags(args[i].substring(OPT_PARAM.length()));
                        } else if (args[i].startsWith(GEN_PARAM)) {
                            validateExclusiveMode(isFileMode, isDirectoryMode, "generazione");
                            generationType = args[i].substring(GEN_PARAM.length());
                            generationCount = parseGenerationCount(args, i, generationType);
                            isGenerationMode = true;
                            i++;
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (isGenerationMode) {
                if (outputPath == null) {
                    throw new IllegalArgumentException("Modalità generazione richiede directory output (-o)");
                }
                return new DriverConfiguration(null, outputPath, false, false, true, generationType, generationCount);
            }
            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new DriverConfiguration(inputPath, outputPath, isFileMode, useParityCache, false, null, 0);
        }

        private void validateExclusiveMode(boolean mode1, boolean mode2, String currentMode) {
            if (mode1 || mode2) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory/generazione sono mutualmente esclusive)");
            }
        }

        private int parseGenerationCount(String[] args, int currentIndex, String generationType) {
            if (!GEN_PIGEONHOLE.equals(generationType)) {
                throw new IllegalArgumentException("Tipo generazione non supportato: " + generationType
                        + ". Supportati: " + GEN_PIGEONHOLE);
            }
            String countArgument = getNextArgument(args, currentIndex + 1, "numero istanze");
            int count;
            try {
                count = Integer.parseInt(countArgument);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero istanze non valido: " + countArgument);
            }
            if (count < MIN_PIGEONHOLE_INSTANCES || count > MAX_PIGEONHOLE_INSTANCES) {
                throw new IllegalArgumentException("Numero istanze deve essere tra " + MIN_PIGEONHOLE_INSTANCES
                        + " e " + MAX_PIGEONHOLE_INSTANCES + ", ricevuto: " + count);
            }
            return count;
        }

        private boolean parseOptionalFlags(String flags) {
            if (flags == null || flags.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            if (flags.equals(OPT_ALL)) {
                return true;
            }
            List<String> unknown = new ArrayList<>();
            for (char flag : flags.toCharArray()) {
                if (!OPT_PARITY_CACHE.equals(String.valueOf(flag))) {
                    unknown.add(String.valueOf(flag));
                }
            }
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException("Opzioni sconosciute: " + unknown);
            }
            return true;
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    //endregion
}
