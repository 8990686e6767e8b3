package org.analisis_llamadas.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.analisis_llamadas.domain.ClavesAnalisis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ruta de motivo de una llamada: categoría general, específica y subtipo.
 * Las partes ausentes se guardan como cadena vacía.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RutaCombinada {

    private String categoriaGeneral;
    private String categoriaEspecifica;
    private String subtipo;
    private String rutaCompleta;
    private String agenteInstalador;

    /**
     * Crea la ruta uniendo las partes presentes con " | " en orden
     * general → específica → subtipo.
     */
    public static RutaCombinada crear(String general, String especifica, String subtipo, String agente) {
        String especificaNormalizada = especifica != null ? especifica : "";
        String subtipoNormalizado = subtipo != null ? subtipo : "";

        return RutaCombinada.builder()
                .categoriaGeneral(general)
                .categoriaEspecifica(especificaNormalizada)
                .subtipo(subtipoNormalizado)
                .rutaCompleta(unirPartes(general, especifica, subtipo))
                .agenteInstalador(agente)
                .build();
    }

    public static String unirPartes(String general, String especifica, String subtipo) {
        List<String> partes = new ArrayList<>(3);
        partes.add(general);
        if (especifica != null) {
            partes.add(especifica);
        }
        if (subtipo != null) {
            partes.add(subtipo);
        }
        return String.join(ClavesAnalisis.SEPARADOR_RUTA, partes);
    }

    /**
     * Separa una ruta completa en sus partes.
     */
    public static List<String> separarRuta(String rutaCompleta) {
        if (rutaCompleta == null || rutaCompleta.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(rutaCompleta.split(Pattern.quote(ClavesAnalisis.SEPARADOR_RUTA), -1));
    }

    @JsonIgnore
    public boolean tieneCategoriaEspecifica() {
        return categoriaEspecifica != null && !categoriaEspecifica.isEmpty();
    }

    @JsonIgnore
    public boolean tieneSubtipo() {
        return subtipo != null && !subtipo.isEmpty();
    }
}
