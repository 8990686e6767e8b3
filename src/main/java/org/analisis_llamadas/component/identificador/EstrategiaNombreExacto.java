package org.analisis_llamadas.component.identificador;

import org.analisis_llamadas.model.TablaDatos;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Coincidencia exacta, sin distinguir mayúsculas, contra una lista de nombres
 * en orden de prioridad.
 */
public class EstrategiaNombreExacto implements EstrategiaIdentificacion {

    private final List<String> nombres;

    public EstrategiaNombreExacto(List<String> nombres) {
        this.nombres = new ArrayList<>(nombres);
    }

    @Override
    public Optional<String> identificar(TablaDatos tabla) {
        List<String> columnas = tabla.getColumnas();
        List<String> columnasMinusculas = new ArrayList<>(columnas.size());
        for (String columna : columnas) {
            columnasMinusculas.add(columna.toLowerCase(Locale.ROOT));
        }

        for (String nombre : nombres) {
            int indice = columnasMinusculas.indexOf(nombre);
            if (indice >= 0) {
                return Optional.of(columnas.get(indice));
            }
        }
        return Optional.empty();
    }

    @Override
    public String getNombre() {
        return "NOMBRE_EXACTO";
    }
}
