package org.analisis_llamadas.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Datos tabulares leídos de una hoja: columnas con nombre, en orden, y filas
 * de igual largo. Una celda vacía se representa con null.
 */
public class TablaDatos {

    @Getter
    private final String nombre;

    @Getter
    private final List<String> columnas;

    private final Map<String, Integer> indicePorColumna;
    private final List<List<Object>> filas;

    public TablaDatos(String nombre, List<String> columnas, List<List<Object>> filas) {
        this.nombre = nombre;
        this.columnas = Collections.unmodifiableList(new ArrayList<>(columnas));
        this.indicePorColumna = new HashMap<>();
        for (int i = 0; i < columnas.size(); i++) {
            indicePorColumna.putIfAbsent(columnas.get(i), i);
        }

        List<List<Object>> copia = new ArrayList<>(filas.size());
        for (List<Object> fila : filas) {
            if (fila.size() != columnas.size()) {
                throw new IllegalArgumentException(String.format(
                        "Fila con %d valores en tabla de %d columnas", fila.size(), columnas.size()));
            }
            copia.add(Collections.unmodifiableList(new ArrayList<>(fila)));
        }
        this.filas = Collections.unmodifiableList(copia);
    }

    public static TablaDatos vacia(String nombre) {
        return new TablaDatos(nombre, Collections.<String>emptyList(), Collections.<List<Object>>emptyList());
    }

    public int getNumeroFilas() {
        return filas.size();
    }

    public boolean estaVacia() {
        return filas.isEmpty();
    }

    public boolean tieneColumna(String columna) {
        return indicePorColumna.containsKey(columna);
    }

    public Object getValor(int fila, String columna) {
        Integer indice = indicePorColumna.get(columna);
        if (indice == null) {
            throw new IllegalArgumentException("Columna inexistente: " + columna);
        }
        return filas.get(fila).get(indice);
    }

    public List<Object> getValoresColumna(String columna) {
        List<Object> valores = new ArrayList<>(filas.size());
        for (int i = 0; i < filas.size(); i++) {
            valores.add(getValor(i, columna));
        }
        return valores;
    }

    /**
     * Primer valor no vacío de la columna, o null si la columna no tiene valores.
     */
    public Object getPrimerValorNoNulo(String columna) {
        for (int i = 0; i < filas.size(); i++) {
            Object valor = getValor(i, columna);
            if (valor != null) {
                return valor;
            }
        }
        return null;
    }

    /**
     * Nueva tabla con las filas cuyo índice cumple el predicado, en el mismo orden.
     */
    public TablaDatos filtrarFilas(IntPredicate predicado) {
        List<List<Object>> retenidas = new ArrayList<>();
        for (int i = 0; i < filas.size(); i++) {
            if (predicado.test(i)) {
                retenidas.add(filas.get(i));
            }
        }
        return new TablaDatos(nombre, columnas, retenidas);
    }
}
