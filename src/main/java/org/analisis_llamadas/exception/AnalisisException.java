package org.analisis_llamadas.exception;

import lombok.Getter;
import org.analisis_llamadas.enums.EtapaAnalisis;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Excepción del análisis de categorías con el contexto necesario para
 * diagnosticar el fallo: archivo, etapa y momento.
 */
@Getter
public class AnalisisException extends RuntimeException {

    private static final DateTimeFormatter FORMATO_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final EtapaAnalisis etapa;
    private final String archivo;
    private final String detalle;
    private final LocalDateTime timestamp;

    public AnalisisException(String detalle, EtapaAnalisis etapa, String archivo) {
        super(detalle);
        this.detalle = detalle;
        this.etapa = etapa;
        this.archivo = archivo;
        this.timestamp = LocalDateTime.now();
    }

    public AnalisisException(String detalle, EtapaAnalisis etapa, String archivo, Throwable cause) {
        super(detalle, cause);
        this.detalle = detalle;
        this.etapa = etapa;
        this.archivo = archivo;
        this.timestamp = LocalDateTime.now();
    }

    public AnalisisException(String detalle, EtapaAnalisis etapa) {
        this(detalle, etapa, null);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(etapa != null ? etapa.getDescripcion() : "análisis").append("]");
        if (archivo != null) {
            sb.append(" archivo '").append(archivo).append("'");
        }
        sb.append(": ").append(detalle);
        return sb.toString();
    }

    /**
     * Mensaje en formato de recuadro para logs y salida de consola.
     */
    public String getMessageDetallado() {
        StringBuilder sb = new StringBuilder();
        sb.append("\n╔══════════════════════════════════════════════════════════════════╗\n");
        sb.append("║ ERROR EN ANÁLISIS DE CATEGORÍAS - ").append(timestamp.format(FORMATO_TIMESTAMP)).append("\n");
        sb.append("╠══════════════════════════════════════════════════════════════════╣\n");
        if (etapa != null) {
            sb.append("║ Etapa: ").append(etapa.getDescripcion()).append("\n");
        }
        if (archivo != null) {
            sb.append("║ Archivo: ").append(archivo).append("\n");
        }
        sb.append("║ Detalle: ").append(detalle).append("\n");
        if (getCause() != null) {
            sb.append("║ Causa: ").append(getCause().toString()).append("\n");
        }
        sb.append("╚══════════════════════════════════════════════════════════════════╝\n");
        return sb.toString();
    }
}
