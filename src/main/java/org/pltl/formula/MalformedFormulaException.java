package org.pltl.formula;

/**
 * Formula non ben formata: arietà incoerente con l'etichetta, etichetta vuota
 * o testo non conforme alla grammatica PLTL.
 */
public class MalformedFormulaException extends IllegalArgumentException {

    public MalformedFormulaException(String message) {
        super(message);
    }

    public MalformedFormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
