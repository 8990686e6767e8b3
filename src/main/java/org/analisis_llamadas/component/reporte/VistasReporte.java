package org.analisis_llamadas.component.reporte;

import lombok.RequiredArgsConstructor;
import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.domain.ClavesAnalisis;
import org.analisis_llamadas.dto.FilaAgenteCategoriaDTO;
import org.analisis_llamadas.dto.FilaDistribucionDTO;
import org.analisis_llamadas.dto.FilaInsightDTO;
import org.analisis_llamadas.dto.FilaInstaladorDTO;
import org.analisis_llamadas.dto.FilaRankingDTO;
import org.analisis_llamadas.dto.FilaResumenEjecutivoDTO;
import org.analisis_llamadas.dto.FilaRutaDTO;
import org.analisis_llamadas.dto.FilaSubcategoriaDTO;
import org.analisis_llamadas.dto.FilaTotalAgenteDTO;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.dto.RespuestaAnalisisDTO;
import org.analisis_llamadas.enums.ImpactoOperativo;
import org.analisis_llamadas.enums.PrioridadNegocio;
import org.analisis_llamadas.enums.SegmentoVolumen;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.DesgloseInstalador;
import org.analisis_llamadas.model.FrecuenciaCategoria;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.analisis_llamadas.model.ResultadoArchivo;
import org.analisis_llamadas.model.RutaCombinada;
import org.analisis_llamadas.utils.FormatoNumeros;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Vistas tabulares sobre un {@link ResultadoAnalisis}: ranking, subcategorías,
 * rutas, instaladores, totales por agente y secciones ejecutivas.
 *
 * Funciones puras: el mismo resultado produce siempre las mismas filas.
 */
@Component
@RequiredArgsConstructor
public class VistasReporte {

    private final AnalisisProperties properties;

    // =============== VISTAS PRINCIPALES ===============

    /**
     * Todas las categorías generales por frecuencia descendente. Los empates
     * conservan el orden de primera aparición.
     */
    public List<FilaRankingDTO> vistaRanking(ResultadoAnalisis resultado) {
        List<FilaRankingDTO> filas = new ArrayList<>();
        int ranking = 1;
        for (FrecuenciaCategoria categoria : resultado.getFrecuenciasGenerales().masComunes()) {
            double porcentaje = resultado.porcentajeDelTotal(categoria.getFrecuencia());
            filas.add(FilaRankingDTO.builder()
                    .ranking(ranking++)
                    .categoria(categoria.getCategoria())
                    .llamadas(categoria.getFrecuencia())
                    .porcentaje(porcentaje)
                    .impactoOperativo(ImpactoOperativo.desdePorcentaje(porcentaje))
                    .build());
        }
        return filas;
    }

    /**
     * Top de valores de las columnas prioritarias (categoria_especifica,
     * subtipo_categoria) con su prioridad de negocio.
     */
    public List<FilaSubcategoriaDTO> vistaSubcategorias(ResultadoAnalisis resultado) {
        List<FilaSubcategoriaDTO> filas = new ArrayList<>();

        for (String clave : ClavesAnalisis.SUBCATEGORIAS_PRIORITARIAS) {
            Optional<ContadorFrecuencias> contador = resultado.getAnalisisDetallado().getFrecuencias(clave);
            if (!contador.isPresent() || contador.get().estaVacio()) {
                continue;
            }

            String tipo = titulo(clave);
            for (FrecuenciaCategoria valor : contador.get().masComunes(properties.getTopSubcategorias())) {
                double porcentaje = resultado.porcentajeDelTotal(valor.getFrecuencia());
                filas.add(FilaSubcategoriaDTO.builder()
                        .tipo(tipo)
                        .subcategoria(valor.getCategoria())
                        .frecuencia(valor.getFrecuencia())
                        .porcentaje(porcentaje)
                        .prioridad(PrioridadNegocio.desdePorcentaje(porcentaje))
                        .build());
            }
        }
        return filas;
    }

    /**
     * Rutas completas por frecuencia, con sus partes tomadas de la primera
     * aparición de cada ruta.
     */
    public List<FilaRutaDTO> vistaRutas(ResultadoAnalisis resultado) {
        List<RutaCombinada> detalle = resultado.getAnalisisDetallado()
                .getRegistros(ClavesAnalisis.CATEGORIA_COMBINADA_DETALLE, RutaCombinada.class);
        if (detalle.isEmpty()) {
            return new ArrayList<>();
        }

        ContadorFrecuencias frecuencias = new ContadorFrecuencias();
        Map<String, RutaCombinada> primeraAparicion = new LinkedHashMap<>();
        for (RutaCombinada ruta : detalle) {
            frecuencias.incrementar(ruta.getRutaCompleta());
            primeraAparicion.putIfAbsent(ruta.getRutaCompleta(), ruta);
        }

        List<FilaRutaDTO> filas = new ArrayList<>(frecuencias.size());
        for (FrecuenciaCategoria frecuencia : frecuencias.masComunes()) {
            RutaCombinada partes = primeraAparicion.get(frecuencia.getCategoria());
            filas.add(FilaRutaDTO.builder()
                    .categoriaGeneral(partes.getCategoriaGeneral())
                    .categoriaEspecifica(partes.getCategoriaEspecifica())
                    .subtipo(partes.getSubtipo())
                    .rutaCompleta(frecuencia.getCategoria())
                    .frecuencia(frecuencia.getFrecuencia())
                    .porcentaje(resultado.porcentajeDelTotal(frecuencia.getFrecuencia()))
                    .build());
        }
        return filas;
    }

    public List<FilaInstaladorDTO> vistaInstaladores(ResultadoAnalisis resultado) {
        List<DesgloseInstalador> desglose = resultado.getAnalisisDetallado()
                .getRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE, DesgloseInstalador.class);

        List<FilaInstaladorDTO> filas = new ArrayList<>(desglose.size());
        for (DesgloseInstalador registro : desglose) {
            filas.add(FilaInstaladorDTO.builder()
                    .agenteInstalador(registro.getAgenteInstalador())
                    .categoriaGeneral(registro.getCategoriaGeneral())
                    .categoriaEspecifica(registro.getCategoriaEspecifica())
                    .subtipo(registro.getSubtipo())
                    .rutaCompleta(registro.getRutaCompleta())
                    .frecuencia(registro.getFrecuencia())
                    .porcentajeAgente(registro.getPorcentajeAgente())
                    .porcentajeAgenteTexto(FormatoNumeros.porcentajeDosDecimales(registro.getPorcentajeAgente()))
                    .build());
        }
        return filas;
    }

    /**
     * Agentes con más llamadas, sumando todas sus rutas. Los empates quedan en
     * orden alfabético de agente.
     */
    public List<FilaTotalAgenteDTO> vistaTotalesPorAgente(ResultadoAnalisis resultado) {
        Map<String, Long> totales = new TreeMap<>();
        for (DesgloseInstalador registro : resultado.getAnalisisDetallado()
                .getRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE, DesgloseInstalador.class)) {
            totales.merge(registro.getAgenteInstalador(), registro.getFrecuencia(), Long::sum);
        }

        List<FilaTotalAgenteDTO> filas = new ArrayList<>(totales.size());
        for (Map.Entry<String, Long> total : totales.entrySet()) {
            filas.add(new FilaTotalAgenteDTO(total.getKey(), total.getValue()));
        }
        filas.sort(Comparator.comparingLong(FilaTotalAgenteDTO::getLlamadas).reversed());
        return new ArrayList<>(filas.subList(0, Math.min(properties.getTopAgentes(), filas.size())));
    }

    /**
     * Llamadas por categoría general de los agentes con más llamadas, ordenadas
     * por agente y categoría.
     */
    public List<FilaAgenteCategoriaDTO> vistaCategoriasPorAgente(ResultadoAnalisis resultado) {
        Set<String> agentes = new HashSet<>();
        for (FilaTotalAgenteDTO total : vistaTotalesPorAgente(resultado)) {
            if (agentes.size() == properties.getTopAgentesCategorias()) {
                break;
            }
            agentes.add(total.getAgenteInstalador());
        }

        Map<String, Map<String, Long>> porAgente = new TreeMap<>();
        for (DesgloseInstalador registro : resultado.getAnalisisDetallado()
                .getRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE, DesgloseInstalador.class)) {
            if (agentes.contains(registro.getAgenteInstalador())) {
                porAgente.computeIfAbsent(registro.getAgenteInstalador(), agente -> new TreeMap<>())
                        .merge(registro.getCategoriaGeneral(), registro.getFrecuencia(), Long::sum);
            }
        }

        List<FilaAgenteCategoriaDTO> filas = new ArrayList<>();
        for (Map.Entry<String, Map<String, Long>> agente : porAgente.entrySet()) {
            for (Map.Entry<String, Long> categoria : agente.getValue().entrySet()) {
                filas.add(new FilaAgenteCategoriaDTO(agente.getKey(), categoria.getKey(), categoria.getValue()));
            }
        }
        return filas;
    }

    // =============== SECCIONES EJECUTIVAS ===============

    public List<FilaResumenEjecutivoDTO> resumenEjecutivo(ResultadoAnalisis resultado) {
        ContadorFrecuencias generales = resultado.getFrecuenciasGenerales();
        long totalFilas = resultado.getTotalFilas();
        int categorias = generales.size();

        long top3 = 0;
        for (FrecuenciaCategoria categoria : generales.masComunes(3)) {
            top3 += categoria.getFrecuencia();
        }
        double concentracion = resultado.porcentajeDelTotal(top3);
        double promedio = categorias > 0 ? (double) totalFilas / categorias : 0.0;

        FiltroFechasDTO filtro = resultado.getFiltroFechas() != null
                ? resultado.getFiltroFechas() : FiltroFechasDTO.sinFiltro();

        List<FilaResumenEjecutivoDTO> filas = new ArrayList<>();
        filas.add(new FilaResumenEjecutivoDTO("Período Analizado", filtro.describirPeriodo(),
                filtro.estaConfigurado() ? "Rango de fechas aplicado a los registros" : "Todos los registros disponibles"));
        filas.add(new FilaResumenEjecutivoDTO("Volumen Total de Llamadas", FormatoNumeros.miles(totalFilas),
                "Indicador clave de volumen de atención"));
        filas.add(new FilaResumenEjecutivoDTO("Número de Categorías Principales", String.valueOf(categorias),
                "Diversidad de motivos de contacto"));
        filas.add(new FilaResumenEjecutivoDTO("Concentración en Top 3 Categorías", FormatoNumeros.porcentaje(concentracion),
                "Peso de los motivos más frecuentes"));
        filas.add(new FilaResumenEjecutivoDTO("Promedio de Llamadas por Categoría", FormatoNumeros.entero(promedio),
                "Eficiencia operativa promedio"));
        filas.add(new FilaResumenEjecutivoDTO("Archivos Procesados", String.valueOf(resultado.getArchivosProcesados()),
                "Cobertura de datos disponible"));
        return filas;
    }

    /**
     * Segmentos ALTO / MEDIO / BAJO volumen, siempre los tres y en ese orden.
     */
    public List<FilaDistribucionDTO> distribucionVolumen(ResultadoAnalisis resultado) {
        Map<SegmentoVolumen, FilaDistribucionDTO> segmentos = new EnumMap<>(SegmentoVolumen.class);
        Map<SegmentoVolumen, List<String>> ejemplos = new EnumMap<>(SegmentoVolumen.class);
        for (SegmentoVolumen segmento : SegmentoVolumen.values()) {
            segmentos.put(segmento, FilaDistribucionDTO.builder().segmento(segmento).ejemplos("").build());
            ejemplos.put(segmento, new ArrayList<>());
        }

        ContadorFrecuencias generales = resultado.getFrecuenciasGenerales();
        for (String categoria : generales.getClaves()) {
            long frecuencia = generales.getFrecuencia(categoria);
            double porcentaje = resultado.porcentajeDelTotal(frecuencia);
            SegmentoVolumen segmento = SegmentoVolumen.desdePorcentaje(porcentaje);

            FilaDistribucionDTO fila = segmentos.get(segmento);
            fila.setCategorias(fila.getCategorias() + 1);
            fila.setLlamadas(fila.getLlamadas() + frecuencia);
            fila.setPorcentaje(fila.getPorcentaje() + porcentaje);
            if (ejemplos.get(segmento).size() < 3) {
                ejemplos.get(segmento).add(categoria);
            }
        }

        for (SegmentoVolumen segmento : SegmentoVolumen.values()) {
            segmentos.get(segmento).setEjemplos(String.join(", ", ejemplos.get(segmento)));
        }
        return new ArrayList<>(segmentos.values());
    }

    public List<FilaInsightDTO> insightsNegocio(ResultadoAnalisis resultado) {
        List<FilaInsightDTO> insights = new ArrayList<>();
        ContadorFrecuencias generales = resultado.getFrecuenciasGenerales();
        if (generales.estaVacio()) {
            return insights;
        }

        FrecuenciaCategoria principal = generales.masComunes(1).get(0);
        double porcentajePrincipal = resultado.porcentajeDelTotal(principal.getFrecuencia());

        if (porcentajePrincipal > 30) {
            insights.add(new FilaInsightDTO("OPORTUNIDAD",
                    String.format(Locale.ROOT, "%.1f%% de llamadas son de \"%s\"", porcentajePrincipal, principal.getCategoria()),
                    "Desarrollar canales digitales especializados para reducir volumen en atención telefónica",
                    "Alto - Reducción significativa de costos operativos"));
        }

        if (generales.size() > 20) {
            insights.add(new FilaInsightDTO("OPTIMIZACIÓN",
                    generales.size() + " categorías diferentes requieren atención especializada",
                    "Implementar sistema de routing automático basado en subcategorías",
                    "Medio - Mejora en tiempos de resolución"));
        }

        insights.add(new FilaInsightDTO("ESTRATEGIA",
                "Las categorías principales representan oportunidades de mejora continua",
                "Establecer KPIs específicos por categoría y monitoreo mensual",
                "Alto - Mejora en calidad de servicio"));
        return insights;
    }

    /**
     * Cobertura de las primeras N categorías sobre el total de filas. Con menos
     * de N categorías se suman todas.
     */
    public double coberturaTop(ResultadoAnalisis resultado) {
        long suma = 0;
        for (FrecuenciaCategoria categoria : resultado.getFrecuenciasGenerales().masComunes(properties.getTopCategorias())) {
            suma += categoria.getFrecuencia();
        }
        return resultado.porcentajeDelTotal(suma);
    }

    /**
     * Todas las vistas y métricas en una sola respuesta.
     */
    public RespuestaAnalisisDTO respuestaCompleta(ResultadoAnalisis resultado) {
        List<String> archivosConError = new ArrayList<>();
        for (ResultadoArchivo archivo : resultado.getResultadosPorArchivo()) {
            if (archivo.isConError()) {
                archivosConError.add(archivo.getNombreArchivo());
            }
        }

        return RespuestaAnalisisDTO.builder()
                .archivosProcesados(resultado.getArchivosProcesados())
                .totalLlamadas(resultado.getTotalFilas())
                .categoriasGenerales(resultado.getFrecuenciasGenerales().size())
                .coberturaTop(coberturaTop(resultado))
                .filtroFechas(resultado.getFiltroFechas())
                .archivosConError(archivosConError)
                .resumenEjecutivo(resumenEjecutivo(resultado))
                .ranking(vistaRanking(resultado))
                .subcategorias(vistaSubcategorias(resultado))
                .rutas(vistaRutas(resultado))
                .instaladores(vistaInstaladores(resultado))
                .totalesPorAgente(vistaTotalesPorAgente(resultado))
                .categoriasPorAgente(vistaCategoriasPorAgente(resultado))
                .distribucion(distribucionVolumen(resultado))
                .insights(insightsNegocio(resultado))
                .build();
    }

    // =============== AUXILIARES ===============

    /** "categoria_especifica" -> "Categoria Especifica" */
    static String titulo(String clave) {
        String[] palabras = clave.replace('_', ' ').split(" ", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < palabras.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            String palabra = palabras[i];
            if (!palabra.isEmpty()) {
                sb.append(palabra.substring(0, 1).toUpperCase(Locale.ROOT))
                        .append(palabra.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return sb.toString();
    }
}
