package org.satba.optionalfeatures;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GENERATORE PIGEONHOLE PROBLEM - Istanze codificate con vincoli di cardinalità
 *
 * Genera istanze del "Pigeonhole Problem" (n+1 piccioni, n buche) nel formato di
 * input del driver, una asserzione per riga. A differenza della codifica CNF
 * classica, che richiede O(n³) clausole binarie, ogni vincolo è un unico
 * predicato di cardinalità.
 *
 * FORMULAZIONE:
 * - Variabili: p{i}_{j} = "piccione i è nella buca j"
 * - ∀i ∈ [1,n+1]: atleast(1: p{i}_1, ..., p{i}_n)
 * - ∀j ∈ [1,n]:   atmost(1: p1_{j}, ..., p{n+1}_{j})
 *
 * Tutte le istanze sono insoddisfacibili per costruzione.
 */
public class PigeonholeProblem {

    private static final Logger LOGGER = Logger.getLogger(PigeonholeProblem.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    private static final String PIGEONHOLE_DIR = "PIGEONHOLE";

    private static final String FILE_PREFIX = "pigeonhole_";

    private static final String FILE_EXTENSION = ".txt";

    private static final int MAX_PROBLEMS = 100;

    //endregion

    //region STATO GENERAZIONE

    private String outputDirectory;

    private int generatedInstances;

    //endregion

    public PigeonholeProblem() {
        this.generatedInstances = 0;
        LOGGER.fine("PigeonholeProblem inizializzato per generazione istanze");
    }

    /**
     * @param outputPath directory base in cui creare la sottodirectory PIGEONHOLE
     * @throws IllegalArgumentException se outputPath null o vuoto
     */
    public void setOutputDirectory(String outputPath) {
        if (outputPath == null || outputPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Directory output non può essere null o vuota");
        }
        this.outputDirectory = outputPath.trim();
        LOGGER.fine("Directory output configurata: " + outputDirectory);
    }

    //region INTERFACCIA PUBBLICA PRINCIPALE

    /**
     * Genera le istanze di dimensione 1..numberOfProblems in PIGEONHOLE/.
     *
     * @param numberOfProblems numero istanze da generare (1 ≤ n ≤ 100)
     * @throws IllegalArgumentException se numberOfProblems fuori intervallo
     * @throws IllegalStateException se la directory di output non è configurata
     * @throws IOException se la scrittura di un file fallisce
     */
    public void generateInstances(int numberOfProblems) throws IOException {
        if (numberOfProblems < 1 || numberOfProblems > MAX_PROBLEMS) {
            throw new IllegalArgumentException("Numero problemi deve essere tra 1 e " + MAX_PROBLEMS
                    + ", ricevuto: " + numberOfProblems);
        }
        if (outputDirectory == null) {
            throw new IllegalStateException("Directory output non configurata - chiamare setOutputDirectory() prima");
        }

        LOGGER.info("Inizio generazione " + numberOfProblems + " istanze Pigeonhole Problem");
        Path pigeonholePath = Paths.get(outputDirectory).resolve(PIGEONHOLE_DIR);
        Files.createDirectories(pigeonholePath);

        generatedInstances = 0;
        try {
            for (int n = 1; n <= numberOfProblems; n++) {
                saveInstance(pigeonholePath, n, buildAssertions(n));
                generatedInstances++;
                if (n % 10 == 0) {
                    System.out.println("[I] Progresso generazione: " + n + "/" + numberOfProblems
                            + " istanze completate");
                }
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore durante generazione istanze Pigeonhole", e);
            System.out.println("[E] Generazione fallita dopo " + generatedInstances + "/" + numberOfProblems
                    + " istanze");
            throw e;
        }

        System.out.println("[I] Generate " + generatedInstances + " istanze in " + pigeonholePath);
    }

    /**
     * Costruisce le asserzioni dell'istanza con n buche, nella sintassi del parser.
     */
    public List<String> buildAssertions(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Servono almeno una buca, ricevuto: " + n);
        }
        List<String> assertions = new ArrayList<>();

        for (int pigeon = 1; pigeon <= n + 1; pigeon++) {
            List<String> holes = new ArrayList<>();
            for (int hole = 1; hole <= n; hole++) {
                holes.add(variable(pigeon, hole));
            }
            assertions.add("atleast(1: " + String.join(", ", holes) + ")");
        }

        for (int hole = 1; hole <= n; hole++) {
            List<String> pigeons = new ArrayList<>();
            for (int pigeon = 1; pigeon <= n + 1; pigeon++) {
                pigeons.add(variable(pigeon, hole));
            }
            assertions.add("atmost(1: " + String.join(", ", pigeons) + ")");
        }

        return assertions;
    }

    public int getGeneratedInstances() {
        return generatedInstances;
    }

    //endregion

    //region SALVATAGGIO FILE

    private void saveInstance(Path directory, int n, List<String> assertions) throws IOException {
        Path filePath = directory.resolve(FILE_PREFIX + n + FILE_EXTENSION);
        try (FileWriter writer = new FileWriter(filePath.toFile())) {
            writer.write("# pigeonhole: " + (n + 1) + " piccioni, " + n + " buche\n");
            for (String assertion : assertions) {
                writer.write(assertion);
                writer.write("\n");
            }
        }
        LOGGER.finest("Istanza n=" + n + " salvata: " + filePath);
    }

    private static String variable(int pigeon, int hole) {
        return "p" + pigeon + "_" + hole;
    }

    //endregion
}
