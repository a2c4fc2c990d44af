package frontend.lexer;

import java.util.HashMap;
import java.util.Map;

/**
 * 伪代码的保留字, 大小写敏感
 */
public enum Keyword {
    ALGORITMO("Algoritmo"),
    FIN_ALGORITMO("FinAlgoritmo"),
    PROCESO("Proceso"),
    FIN_PROCESO("FinProceso"),
    SUB_PROCESO("SubProceso"),
    FIN_SUB_PROCESO("FinSubProceso"),
    SI("Si"),
    ENTONCES("Entonces"),
    SINO("Sino"),
    FIN_SI("FinSi"),
    SEGUN("Segun"),
    FIN_SEGUN("FinSegun"),
    PARA("Para"),
    FIN_PARA("FinPara"),
    MIENTRAS("Mientras"),
    FIN_MIENTRAS("FinMientras"),
    REPETIR("Repetir"),
    HASTA("Hasta"),
    ESCRIBIR("Escribir"),
    LEER("Leer"),
    FUNCION("Funcion"),
    FIN_FUNCION("FinFuncion"),
    RETORNAR("Retornar"),
    VERDADERO("Verdadero"),
    FALSO("Falso"),
    ;

    private static final Map<String, Keyword> BY_TEXT = new HashMap<>();

    static {
        for (Keyword keyword : values()) {
            BY_TEXT.put(keyword.text, keyword);
        }
    }

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public static boolean isReserved(String word) {
        return BY_TEXT.containsKey(word);
    }

    // null if word is not reserved
    public static Keyword of(String word) {
        return BY_TEXT.get(word);
    }

    @Override
    public String toString() {
        return text;
    }
}
