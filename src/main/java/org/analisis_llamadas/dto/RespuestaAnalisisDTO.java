package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Respuesta del endpoint de análisis: métricas principales y todas las vistas.
 */
@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class RespuestaAnalisisDTO {

    private int archivosProcesados;
    private long totalLlamadas;
    private int categoriasGenerales;

    /** Cobertura de las primeras categorías sobre el total de filas */
    private double coberturaTop;
    private FiltroFechasDTO filtroFechas;

    /** Archivos que fallaron y no aportaron datos */
    private List<String> archivosConError;

    private List<FilaResumenEjecutivoDTO> resumenEjecutivo;
    private List<FilaRankingDTO> ranking;
    private List<FilaSubcategoriaDTO> subcategorias;
    private List<FilaRutaDTO> rutas;
    private List<FilaInstaladorDTO> instaladores;
    private List<FilaTotalAgenteDTO> totalesPorAgente;
    private List<FilaAgenteCategoriaDTO> categoriasPorAgente;
    private List<FilaDistribucionDTO> distribucion;
    private List<FilaInsightDTO> insights;
}
