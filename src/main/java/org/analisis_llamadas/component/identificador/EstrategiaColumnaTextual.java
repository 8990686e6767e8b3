package org.analisis_llamadas.component.identificador;

import org.analisis_llamadas.model.TablaDatos;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Último recurso: primera columna con valores de texto no numéricos cuyo
 * nombre no empieza con un prefijo excluido (id, fecha, hora...).
 */
public class EstrategiaColumnaTextual implements EstrategiaIdentificacion {

    private final List<String> prefijosExcluidos;

    public EstrategiaColumnaTextual(List<String> prefijosExcluidos) {
        this.prefijosExcluidos = new ArrayList<>(prefijosExcluidos);
    }

    @Override
    public Optional<String> identificar(TablaDatos tabla) {
        for (String columna : tabla.getColumnas()) {
            if (tienePrefijoExcluido(columna)) {
                continue;
            }
            if (esTextual(tabla, columna)) {
                return Optional.of(columna);
            }
        }
        return Optional.empty();
    }

    private boolean tienePrefijoExcluido(String columna) {
        String minusculas = columna.toLowerCase(Locale.ROOT);
        for (String prefijo : prefijosExcluidos) {
            if (minusculas.startsWith(prefijo)) {
                return true;
            }
        }
        return false;
    }

    private boolean esTextual(TablaDatos tabla, String columna) {
        for (Object valor : tabla.getValoresColumna(columna)) {
            if (valor instanceof String && !esNumero((String) valor)) {
                return true;
            }
        }
        return false;
    }

    private boolean esNumero(String texto) {
        try {
            Double.parseDouble(texto.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Override
    public String getNombre() {
        return "COLUMNA_TEXTUAL";
    }
}
