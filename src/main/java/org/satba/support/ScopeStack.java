package org.satba.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

/**
 * SCOPE STACK - Stack gerarchico degli scope di backtracking dello store
 *
 * Ogni scope aperto registra la dimensione delle strutture dello store al momento
 * dell'apertura, così che la chiusura possa ritrarre esattamente ciò che è stato
 * aggiunto nello scope.
 *
 * ORGANIZZAZIONE GERARCHICA:
 * • Livello 0: asserzioni incondizionate (sempre presente, mai rimosso)
 * • Livello i (i>0): scope utente aperto con push()
 *
 * INVARIANTI MANTENUTE:
 * • Lo stack contiene sempre almeno il livello 0
 * • I marcatori sono monotoni: un livello più alto non precede mai uno più basso
 */
public class ScopeStack {

    private static final Logger LOGGER = Logger.getLogger(ScopeStack.class.getName());

    /**
     * Marcatore di uno scope: numero di vincoli e clausole presenti all'apertura.
     */
    public record ScopeMark(int constraintCount, int clauseCount) {
        public ScopeMark {
            if (constraintCount < 0 || clauseCount < 0) {
                throw new IllegalArgumentException("Marcatore scope non valido: "
                        + constraintCount + "/" + clauseCount);
            }
        }
    }

    private final Deque<ScopeMark> marks;

    public ScopeStack() {
        this.marks = new ArrayDeque<>();
        LOGGER.fine("ScopeStack inizializzato al livello 0");
    }

    /**
     * Apre un nuovo scope registrando lo stato corrente dello store.
     */
    public void push(int constraintCount, int clauseCount) {
        ScopeMark mark = new ScopeMark(constraintCount, clauseCount);
        if (!marks.isEmpty()) {
            ScopeMark top = marks.peek();
            if (top.constraintCount() > constraintCount || top.clauseCount() > clauseCount) {
                throw new IllegalStateException("Marcatore non monotono: " + mark + " dopo " + top);
            }
        }
        marks.push(mark);
        LOGGER.fine("Scope aperto: livello=" + depth() + ", marcatore=" + mark);
    }

    /**
     * Chiude lo scope più interno.
     *
     * @return marcatore registrato all'apertura dello scope
     * @throws IllegalStateException se nessuno scope è aperto (il livello 0 è protetto)
     */
    public ScopeMark pop() {
        if (marks.isEmpty()) {
            throw new IllegalStateException("Impossibile chiudere il livello 0");
        }
        ScopeMark mark = marks.pop();
        LOGGER.fine("Scope chiuso: nuovo livello=" + depth() + ", ripristino a " + mark);
        return mark;
    }

    /**
     * @return numero di scope aperti (0 = livello radice)
     */
    public int depth() {
        return marks.size();
    }

    public boolean isAtRootLevel() {
        return marks.isEmpty();
    }

    @Override
    public String toString() {
        return "ScopeStack{livello=" + depth() + "}";
    }
}
