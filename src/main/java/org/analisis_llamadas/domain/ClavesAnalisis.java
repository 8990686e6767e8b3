package org.analisis_llamadas.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Claves fijas del análisis detallado.
 */
public final class ClavesAnalisis {

    private ClavesAnalisis() {}

    public static final String CATEGORIA_COMBINADA = "categoria_combinada";
    public static final String CATEGORIA_COMBINADA_DETALLE = "categoria_combinada_detalle";
    public static final String AGENTE_INSTALADOR_DETALLE = "agente_instalador_detalle";

    /** Columnas destacadas en el análisis de subcategorías, en orden */
    public static final List<String> SUBCATEGORIAS_PRIORITARIAS = Collections.unmodifiableList(
            Arrays.asList("categoria_especifica", "subtipo_categoria"));

    public static final String SEPARADOR_RUTA = " | ";
}
