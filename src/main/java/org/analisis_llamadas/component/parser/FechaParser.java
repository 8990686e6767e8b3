package org.analisis_llamadas.component.parser;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.utils.RegexUtils;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Convierte valores heterogéneos de celdas en fechas.
 *
 * Orden de intento:
 * 1. Valores temporales nativos (LocalDateTime, LocalDate, Date)
 * 2. Patrón YYYY-MM-DD + HH:MM:SS con separadores flexibles, estricto
 * 3. Patrón YYYY-MM-DD, estricto
 * 4. Formatos comunes sobre el texto completo, tolerante
 *
 * Nunca lanza excepción: un valor no reconocible devuelve Optional.empty().
 */
@Slf4j
@Component
public class FechaParser {

    private static final DateTimeFormatter FORMATO_FECHA_HORA_ESTRICTO =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter FORMATO_FECHA_ESTRICTO =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    /** Formatos del intento tolerante. Mes primero antes que día primero en fechas ambiguas. */
    private static final List<DateTimeFormatter> FORMATOS_TOLERANTES = Collections.unmodifiableList(Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            formatoConHoraOpcional("uuuu-MM-dd"),
            formatoConHoraOpcional("uuuu/MM/dd"),
            formatoConHoraOpcional("M/d/uuuu"),
            formatoConHoraOpcional("d/M/uuuu"),
            formatoConHoraOpcional("d-M-uuuu"),
            formatoConHoraOpcional("d.M.uuuu"),
            formatoConHoraOpcional("uuuuMMdd"),
            new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendPattern("d MMM uuuu").toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendPattern("MMM d, uuuu").toFormatter(Locale.ENGLISH)
    ));

    private static DateTimeFormatter formatoConHoraOpcional(String patronFecha) {
        return new DateTimeFormatterBuilder()
                .appendPattern(patronFecha)
                .optionalStart()
                .appendPattern(" HH:mm")
                .optionalStart()
                .appendPattern(":ss")
                .optionalEnd()
                .optionalEnd()
                .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
                .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
                .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Convierte un valor en fecha si contiene una fecha reconocible.
     *
     * @param valor Valor de celda (puede ser null)
     * @return Fecha reconocida, o vacío si el valor no es una fecha
     */
    public Optional<LocalDateTime> parsear(Object valor) {
        if (valor == null) {
            return Optional.empty();
        }

        Optional<LocalDateTime> nativa = convertirTemporalNativo(valor);
        if (nativa.isPresent()) {
            return nativa;
        }

        String texto = String.valueOf(valor).trim();
        if (texto.isEmpty()) {
            return Optional.empty();
        }

        Matcher conHora = RegexUtils.FECHA_CON_HORA_PATTERN.matcher(texto);
        if (conHora.find()) {
            String fechaHora = String.format("%s %s:%s:%s",
                    conHora.group(1), conHora.group(2), conHora.group(3), conHora.group(4));
            try {
                return Optional.of(LocalDateTime.parse(fechaHora, FORMATO_FECHA_HORA_ESTRICTO));
            } catch (DateTimeParseException e) {
                log.trace("Fecha con hora inválida '{}': {}", fechaHora, e.getMessage());
            }
        }

        Matcher soloFecha = RegexUtils.SOLO_FECHA_PATTERN.matcher(texto);
        if (soloFecha.find()) {
            try {
                return Optional.of(LocalDate.parse(soloFecha.group(1), FORMATO_FECHA_ESTRICTO).atStartOfDay());
            } catch (DateTimeParseException e) {
                log.trace("Fecha inválida '{}': {}", soloFecha.group(1), e.getMessage());
            }
        }

        return parsearTolerante(texto);
    }

    private Optional<LocalDateTime> convertirTemporalNativo(Object valor) {
        if (valor instanceof LocalDateTime) {
            return Optional.of((LocalDateTime) valor);
        }
        if (valor instanceof LocalDate) {
            return Optional.of(((LocalDate) valor).atStartOfDay());
        }
        if (valor instanceof ZonedDateTime) {
            return Optional.of(((ZonedDateTime) valor).toLocalDateTime());
        }
        if (valor instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) valor).toLocalDateTime());
        }
        if (valor instanceof Date) {
            return Optional.of(LocalDateTime.ofInstant(((Date) valor).toInstant(), ZoneId.systemDefault()));
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> parsearTolerante(String texto) {
        for (DateTimeFormatter formato : FORMATOS_TOLERANTES) {
            try {
                TemporalAccessor parseado = formato.parse(texto);
                if (parseado.isSupported(ChronoField.HOUR_OF_DAY)) {
                    return Optional.of(LocalDateTime.from(parseado));
                }
                return Optional.of(LocalDate.from(parseado).atStartOfDay());
            } catch (DateTimeException e) {
                log.trace("Formato {} no aplicable a '{}': {}", formato, texto, e.getMessage());
            }
        }

        log.debug("Valor no reconocido como fecha: '{}'", texto);
        return Optional.empty();
    }
}
