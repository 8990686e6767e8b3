package org.analisis_llamadas.service;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.enums.EtapaAnalisis;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Analiza archivos recibidos por HTTP.
 *
 * Cada archivo se copia a un directorio temporal propio de la petición,
 * conservando su nombre original, y el directorio se elimina siempre al
 * terminar, con éxito o con error.
 */
@Slf4j
@Service
public class ArchivosSubidosService {

    @Autowired
    private AnalisisCategoriasService analisisCategoriasService;

    @Autowired
    private AnalisisProperties properties;

    /**
     * @throws AnalisisException Si no hay archivos, alguno tiene extensión no
     *                           soportada o no puede copiarse
     */
    public ResultadoAnalisis analizar(List<MultipartFile> archivos, FiltroFechasDTO filtro) {
        if (archivos == null || archivos.isEmpty()) {
            throw new AnalisisException("No se recibieron archivos para analizar", EtapaAnalisis.VALIDACION);
        }
        for (MultipartFile archivo : archivos) {
            if (!properties.isExtensionSoportada(archivo.getOriginalFilename())) {
                throw new AnalisisException("Extensión no soportada. Se aceptan: " + properties.getExtensiones(),
                        EtapaAnalisis.VALIDACION, archivo.getOriginalFilename());
            }
        }

        Path directorioTemporal = crearDirectorioTemporal();
        List<Path> copias = new ArrayList<>(archivos.size());
        try {
            for (MultipartFile archivo : archivos) {
                copias.add(copiarArchivo(archivo, directorioTemporal));
            }
            return analisisCategoriasService.analizarArchivosConCategorias(copias, filtro);
        } finally {
            eliminarTemporales(directorioTemporal);
        }
    }

    // =============== ARCHIVOS TEMPORALES ===============

    private Path crearDirectorioTemporal() {
        try {
            return Files.createTempDirectory(properties.getPrefijoTemporal());
        } catch (IOException e) {
            throw new AnalisisException("No se pudo crear el directorio temporal: " + e.getMessage(),
                    EtapaAnalisis.LECTURA, null, e);
        }
    }

    private Path copiarArchivo(MultipartFile archivo, Path directorio) {
        // Sólo el nombre, sin rutas que puedan venir del cliente
        String nombre = Paths.get(archivo.getOriginalFilename()).getFileName().toString();
        Path destino = directorio.resolve(nombre);
        if (Files.exists(destino)) {
            destino = directorio.resolve(properties.getPrefijoTemporal() + System.nanoTime() + "_" + nombre);
        }

        try (InputStream entrada = archivo.getInputStream()) {
            Files.copy(entrada, destino, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Archivo subido {} copiado a {} ({} bytes)", nombre, destino, archivo.getSize());
            return destino;
        } catch (IOException e) {
            throw new AnalisisException("No se pudo guardar el archivo subido: " + e.getMessage(),
                    EtapaAnalisis.LECTURA, nombre, e);
        }
    }

    /**
     * Un fallo al borrar se registra y nunca reemplaza al error original.
     */
    private void eliminarTemporales(Path directorio) {
        try (Stream<Path> contenido = Files.list(directorio)) {
            contenido.forEach(this::eliminarRuta);
        } catch (IOException e) {
            log.warn("No se pudo listar el directorio temporal {}: {}", directorio, e.getMessage());
        }
        eliminarRuta(directorio);
    }

    private void eliminarRuta(Path ruta) {
        try {
            Files.deleteIfExists(ruta);
        } catch (IOException e) {
            log.warn("No se pudo eliminar el temporal {}: {}", ruta, e.getMessage());
        }
    }
}
