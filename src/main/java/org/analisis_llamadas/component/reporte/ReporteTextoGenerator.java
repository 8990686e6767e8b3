package org.analisis_llamadas.component.reporte;

import lombok.RequiredArgsConstructor;
import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.EntradaAnalisis;
import org.analisis_llamadas.model.FrecuenciaCategoria;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.analisis_llamadas.utils.FormatoNumeros;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reporte de texto plano con anchos de columna fijos.
 *
 * Secciones: encabezado con totales y cobertura, todas las categorías
 * generales, y el top de cada conteo del análisis detallado. Las listas de
 * detalle no se incluyen.
 */
@Component
@RequiredArgsConstructor
public class ReporteTextoGenerator {

    private static final String LINEA_DOBLE = repetir('=', 100);
    private static final String LINEA_SIMPLE = repetir('-', 100);
    private static final String LINEA_CORTA = repetir('-', 60);

    private final AnalisisProperties properties;
    private final VistasReporte vistasReporte;

    public String generar(ResultadoAnalisis resultado) {
        ContadorFrecuencias generales = resultado.getFrecuenciasGenerales();
        long totalFilas = resultado.getTotalFilas();
        StringBuilder sb = new StringBuilder();

        linea(sb, LINEA_DOBLE);
        linea(sb, "ANÁLISIS ESPECIALIZADO DE CATEGORÍAS Y SUBTIPOS");
        linea(sb, LINEA_DOBLE);
        linea(sb, "Archivos procesados: " + resultado.getArchivosProcesados());
        linea(sb, "Filas totales analizadas: " + FormatoNumeros.miles(totalFilas));
        linea(sb, "Categorías generales únicas encontradas: " + FormatoNumeros.miles(generales.size()));

        List<FrecuenciaCategoria> todas = generales.masComunes();
        if (!todas.isEmpty()) {
            String cobertura = String.format(Locale.ROOT, "%.1f%%", vistasReporte.coberturaTop(resultado));

            linea(sb, "Cobertura de top " + properties.getTopCategorias() + " categorías generales: " + cobertura);
            linea(sb, "");
            linea(sb, "📊 TODAS LAS CATEGORÍAS GENERALES ENCONTRADAS:");
            linea(sb, LINEA_SIMPLE);

            int i = 1;
            for (FrecuenciaCategoria categoria : todas) {
                linea(sb, String.format(Locale.ROOT, "%2d. %-50s %4d (%4.1f%%)", i++,
                        categoria.getCategoria(), categoria.getFrecuencia(),
                        resultado.porcentajeDelTotal(categoria.getFrecuencia())));
            }

            linea(sb, LINEA_SIMPLE);
            linea(sb, "Cobertura total de categorías generales: " + cobertura);
        } else {
            linea(sb, "No se encontraron categorías generales para mostrar.");
        }

        if (!resultado.getAnalisisDetallado().estaVacio()) {
            linea(sb, "");
            linea(sb, LINEA_DOBLE);
            linea(sb, "ANÁLISIS DETALLADO DE CATEGORÍAS Y SUBTIPOS");
            linea(sb, LINEA_DOBLE);

            for (Map.Entry<String, EntradaAnalisis> entrada : resultado.getAnalisisDetallado().getEntradas().entrySet()) {
                if (!entrada.getValue().esFrecuencias() || entrada.getValue().estaVacia()) {
                    continue;
                }
                agregarSeccionColumna(sb, entrada.getKey(), entrada.getValue().getFrecuencias(), totalFilas);
            }
        }

        sb.append(LINEA_DOBLE);
        return sb.toString();
    }

    private void agregarSeccionColumna(StringBuilder sb, String columna, ContadorFrecuencias contador, long totalFilas) {
        linea(sb, "");
        linea(sb, "🔍 ANÁLISIS DE '" + columna.toUpperCase(Locale.ROOT) + "':");
        linea(sb, "Valores únicos encontrados: " + contador.size());
        linea(sb, LINEA_CORTA);

        int i = 1;
        for (FrecuenciaCategoria valor : contador.masComunes(properties.getTopDetalle())) {
            linea(sb, String.format(Locale.ROOT, "%3d. %-45s %4d (%5.1f%%)", i++,
                    truncar(valor.getCategoria()), valor.getFrecuencia(),
                    FormatoNumeros.porcentajeDe(valor.getFrecuencia(), totalFilas)));
        }

        linea(sb, LINEA_CORTA);
    }

    String truncar(String valor) {
        int maximo = properties.getLongitudMaximaTexto();
        return valor.length() > maximo ? valor.substring(0, maximo) + "..." : valor;
    }

    private static void linea(StringBuilder sb, String texto) {
        sb.append(texto).append('\n');
    }

    private static String repetir(char caracter, int veces) {
        StringBuilder sb = new StringBuilder(veces);
        for (int i = 0; i < veces; i++) {
            sb.append(caracter);
        }
        return sb.toString();
    }
}
