package org.analisis_llamadas.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.analisis_llamadas.exception.FiltroFechasInvalidoException;
import org.analisis_llamadas.utils.RegexUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Rango de fechas opcional, inclusivo en ambos extremos. Cada extremo se
 * aplica de forma independiente.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class FiltroFechasDTO {

    private static final DateTimeFormatter FORMATO_FECHA =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime fechaInicio;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime fechaFin;

    public static FiltroFechasDTO sinFiltro() {
        return new FiltroFechasDTO();
    }

    /**
     * Construye el filtro desde texto YYYY-MM-DD.
     *
     * @param inicio Fecha de inicio (puede ser null o vacía)
     * @param fin Fecha de fin (puede ser null o vacía)
     * @param finHastaFinDelDia Si la fecha de fin incluye todo el día (23:59:59.999999999)
     *                          o sólo su medianoche
     * @throws FiltroFechasInvalidoException Si alguna fecha es inválida o el rango está invertido
     */
    public static FiltroFechasDTO desdeTexto(String inicio, String fin, boolean finHastaFinDelDia) {
        LocalDate fechaInicio = parsearFecha(inicio, "inicio");
        LocalDate fechaFin = parsearFecha(fin, "fin");

        FiltroFechasDTO filtro = FiltroFechasDTO.builder()
                .fechaInicio(fechaInicio != null ? fechaInicio.atStartOfDay() : null)
                .fechaFin(fechaFin == null ? null
                        : finHastaFinDelDia ? fechaFin.atTime(LocalTime.MAX) : fechaFin.atStartOfDay())
                .build();
        filtro.validar();
        return filtro;
    }

    private static LocalDate parsearFecha(String texto, String extremo) {
        if (texto == null || texto.trim().isEmpty()) {
            return null;
        }
        String limpio = texto.trim();
        if (!RegexUtils.FECHA_FILTRO_PATTERN.matcher(limpio).matches()) {
            throw new FiltroFechasInvalidoException(String.format(
                    "Formato de fecha de %s inválido '%s'. Use YYYY-MM-DD", extremo, texto));
        }
        try {
            return LocalDate.parse(limpio, FORMATO_FECHA);
        } catch (DateTimeParseException e) {
            throw new FiltroFechasInvalidoException(String.format(
                    "Fecha de %s inexistente '%s'. Use YYYY-MM-DD", extremo, texto), e);
        }
    }

    /**
     * Valida que el inicio no sea posterior al fin.
     */
    public void validar() {
        if (fechaInicio != null && fechaFin != null && fechaInicio.isAfter(fechaFin)) {
            throw new FiltroFechasInvalidoException(
                    "La fecha de inicio debe ser anterior o igual a la fecha de fin");
        }
    }

    public boolean estaConfigurado() {
        return fechaInicio != null || fechaFin != null;
    }

    /**
     * Verifica si una fecha cae dentro del rango. Sin fecha, sólo pasa si no
     * hay ningún extremo activo.
     */
    public boolean contiene(LocalDateTime fecha) {
        if (fecha == null) {
            return !estaConfigurado();
        }
        if (fechaInicio != null && fecha.isBefore(fechaInicio)) {
            return false;
        }
        return fechaFin == null || !fecha.isAfter(fechaFin);
    }

    /**
     * Descripción legible del período analizado.
     */
    public String describirPeriodo() {
        DateTimeFormatter formato = DateTimeFormatter.ofPattern("yyyy-MM-dd");
        if (fechaInicio != null && fechaFin != null) {
            return fechaInicio.format(formato) + " a " + fechaFin.format(formato);
        }
        if (fechaInicio != null) {
            return "Desde " + fechaInicio.format(formato);
        }
        if (fechaFin != null) {
            return "Hasta " + fechaFin.format(formato);
        }
        return "Sin filtro de fechas";
    }
}
