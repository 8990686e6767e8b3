package org.analisis_llamadas.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Data
@Configuration
@Validated
@ConfigurationProperties(prefix = "analisis")
public class AnalisisProperties {

    /** Directorio donde se buscan los archivos cuando no se indican explícitamente */
    @NotBlank(message = "El directorio de resultados es obligatorio")
    private String directorioResultados = "results";

    /** Extensiones de archivo aceptadas como entrada */
    @NotEmpty(message = "Debe aceptarse al menos una extensión")
    private List<String> extensiones = new ArrayList<>(Arrays.asList("xlsx", "xls", "csv"));

    @Min(1)
    private int topCategorias = 50;

    @Min(1)
    private int topDetalle = 20;

    @Min(1)
    private int topSubcategorias = 5;

    /** Agentes con más llamadas en la vista de totales por agente */
    @Min(1)
    private int topAgentes = 15;

    /** Agentes incluidos en la distribución de categorías por agente */
    @Min(1)
    private int topAgentesCategorias = 10;

    /** Largo a partir del cual se truncan valores en el reporte de texto */
    @Min(value = 1, message = "La longitud máxima debe ser positiva")
    private int longitudMaximaTexto = 45;

    @NotBlank
    private String hojaDashboard = "Dashboard_Ejecutivo";

    @NotBlank
    private String hojaInstaladores = "Agentes_Instaladores";

    /** Prefijo de los archivos temporales creados para archivos subidos */
    private String prefijoTemporal = "analisis_";

    /**
     * Verificar si una extensión de archivo está soportada
     */
    public boolean isExtensionSoportada(String nombreArchivo) {
        if (nombreArchivo == null) {
            return false;
        }
        int punto = nombreArchivo.lastIndexOf('.');
        if (punto < 0) {
            return false;
        }
        String extension = nombreArchivo.substring(punto + 1).toLowerCase(Locale.ROOT);
        return extensiones != null && extensiones.contains(extension);
    }
}
