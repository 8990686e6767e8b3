package org.analisis_llamadas.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Catálogo de nombres de columna conocidos en las exportaciones de llamadas.
 * El orden de cada lista es el orden de prioridad de búsqueda.
 */
public final class ColumnasConocidas {

    private ColumnasConocidas() {}

    private static List<String> listaInmutable(String... nombres) {
        return Collections.unmodifiableList(Arrays.asList(nombres));
    }

    // =============== CATEGORÍAS ===============

    public static final String CATEGORIA_GENERAL = "categoria_general";

    public static final List<String> SINONIMOS_CATEGORIA = listaInmutable(
            "categoria", "categoría", "category", "tipo", "type",
            "motivo", "reason", "clasificacion", "clasificación",
            "resultado", "result", "estado", "status",
            "categoria_principal", "categoria_secundaria",
            "categoria_final", "categoria_detectada"
    );

    public static final List<String> PALABRAS_CLAVE_CATEGORIA = listaInmutable(
            "categoria", "category", "tipo", "motivo"
    );

    /** Prefijos de columnas que nunca se usan como categoría de último recurso */
    public static final List<String> PREFIJOS_NO_CATEGORIA = listaInmutable(
            "id", "fecha", "date", "hora", "time"
    );

    /** Columnas de categoría específica y subtipo analizadas en detalle */
    public static final List<String> COLUMNAS_CATEGORIA_ESPECIFICA = listaInmutable(
            "categoria_especifica", "subtipo_categoria",
            "categoria_especifica_1", "subtipo_categoria_1",
            "categoria_especifica_2", "subtipo_categoria_2",
            "categoria_especifica_3", "subtipo_categoria_3",
            "categoria", "tipo", "motivo", "subcategoria", "subtipo"
    );

    public static final String FRAGMENTO_CATEGORIA_ESPECIFICA = "categoria_especifica";
    public static final String FRAGMENTO_SUBTIPO = "subtipo_categoria";

    // =============== FECHAS ===============

    public static final List<String> NOMBRES_FECHA = listaInmutable(
            "fecha", "date", "fecha_llamada", "fecha_hora", "timestamp",
            "fecha_inicio", "fecha_fin", "fecha_creacion", "created_date",
            "dia", "day", "fecha_registro", "fecha_contacto", "archivo_procesado"
    );

    public static final List<String> PALABRAS_CLAVE_FECHA = listaInmutable(
            "fecha", "date", "dia", "time", "archivo"
    );

    // =============== AGENTES INSTALADORES ===============

    public static final List<String> SINONIMOS_INSTALADOR = listaInmutable(
            "agente_instalador", "instalador", "tecnico_instalador",
            "tecnico", "agenteinstalador", "instalador_agente"
    );

    public static final List<String> PALABRAS_CLAVE_INSTALADOR = listaInmutable(
            "instalador", "tecnico", "agente"
    );

    public static final String SIN_ASIGNAR = "Sin asignar";
}
