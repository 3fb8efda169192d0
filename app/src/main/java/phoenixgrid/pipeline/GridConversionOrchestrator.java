package phoenixgrid.pipeline;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.config.ConversionConfig;
import phoenixgrid.domain.exception.ModelDiscoveryException;
import phoenixgrid.domain.exception.PhoenixGridException;
import phoenixgrid.domain.grid.OutputGrid;
import phoenixgrid.domain.model.ModelGroup;
import phoenixgrid.domain.report.ConversionReport;
import phoenixgrid.domain.report.ConversionReport.RejectedFile;
import phoenixgrid.domain.report.ConversionReport.SkippedGroup;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.factory.CanonicalGridFactory;
import phoenixgrid.io.ConversionReportWriter;
import phoenixgrid.io.FitsGridWriter;
import phoenixgrid.io.ModelDiscovery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Orquesta una ejecución completa de la conversión.
 * Facade de alto nivel sobre {@link GroupConversionProcessor}.
 * <p>
 * Secuencia: descubrimiento -> agrupación -> rejilla canónica (una sola vez) -> por cada grupo
 * (carga, limpieza, remuestreo, ensamblado, escritura) -> resumen e informe.
 * <p>
 * Política de errores: un fallo de grupo se registra con la clave del grupo y se continúa con
 * el siguiente. Solo abortan la ejecución la ausencia de modelos, un directorio de modelos
 * ilegible, un fallo al construir la rejilla o al escribir el informe.
 */
@Slf4j
public class GridConversionOrchestrator implements AutoCloseable {

    /**
     * Tipo registrado para fallos de grupo que no son errores de dominio ni de E/S.
     */
    static final String UNEXPECTED_ERROR_KIND = "PipelineError";

    private final ConversionConfig config;
    private final ModelDiscovery discovery;
    private final ModelGrouper grouper;
    private final GroupConversionProcessor processor;
    private final FitsGridWriter gridWriter;
    private final ConversionReportWriter reportWriter;
    private final Supplier<CanonicalGrid> gridSupplier;
    private final Clock clock;

    public GridConversionOrchestrator(ConversionConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param clock Reloj único de la ejecución: fechas del informe y tarjeta CREATED de cada tabla.
     */
    public GridConversionOrchestrator(ConversionConfig config, Clock clock) {
        this(config,
                new ModelDiscovery(),
                new ModelGrouper(),
                new GroupConversionProcessor(config, clock),
                new FitsGridWriter(config.isOverwriteExisting()),
                new ConversionReportWriter(),
                CanonicalGridFactory::createStandardGrid,
                clock);
    }

    public GridConversionOrchestrator(ConversionConfig config,
                                      ModelDiscovery discovery,
                                      ModelGrouper grouper,
                                      GroupConversionProcessor processor,
                                      FitsGridWriter gridWriter,
                                      ConversionReportWriter reportWriter,
                                      Supplier<CanonicalGrid> gridSupplier,
                                      Clock clock) {
        this.config = config;
        this.discovery = discovery;
        this.grouper = grouper;
        this.processor = processor;
        this.gridWriter = gridWriter;
        this.reportWriter = reportWriter;
        this.gridSupplier = gridSupplier;
        this.clock = clock;
    }

    /**
     * Ejecuta la conversión completa.
     *
     * @return El informe con las tablas producidas y los grupos descartados.
     * @throws ModelDiscoveryException si no hay ningún modelo candidato.
     * @throws IOException             si el directorio de modelos no se puede leer o falla el informe.
     */
    public ConversionReport run() throws IOException {
        ConversionReport.ConversionReportBuilder report = ConversionReport.builder()
                .startedAt(clock.instant())
                .modelDirectory(config.getModelDirectory().toAbsolutePath().toString())
                .outputDirectory(config.getOutputDirectory().toAbsolutePath().toString());

        List<Path> models = discovery.findModels(config.getModelDirectory(), config.getModelFilePattern());
        if (models.isEmpty()) {
            throw new ModelDiscoveryException(config.getModelDirectory(), config.getModelFilePattern());
        }

        ModelGrouper.GroupingResult grouping = grouper.group(models);
        grouping.rejected().forEach(rejected -> report.rejectedFile(
                new RejectedFile(String.valueOf(rejected.getPath().getFileName()), rejected.getMessage())));

        CanonicalGrid grid = gridSupplier.get();

        for (ModelGroup group : grouping.groups().values()) {
            log.info("Procesando temperatura/metalicidad {} ({} ficheros)", group.key(), group.size());
            try {
                OutputGrid output = processor.process(group, grid);
                Path written = gridWriter.write(output, config.getOutputDirectory());
                report.producedArtifact(written.getFileName().toString());
            } catch (PhoenixGridException e) {
                log.error("Grupo {} descartado ({}): {}", group.key(), e.getErrorKind(), e.getMessage(), e);
                report.skippedGroup(new SkippedGroup(group.key().toString(), e.getErrorKind(), e.getMessage()));
            } catch (IOException | UncheckedIOException e) {
                log.error("Grupo {} descartado por error de E/S: {}", group.key(), e.getMessage(), e);
                report.skippedGroup(new SkippedGroup(group.key().toString(), "IOError", String.valueOf(e.getMessage())));
            } catch (RuntimeException e) {
                log.error("Grupo {} descartado por error inesperado: {}", group.key(), e.getMessage(), e);
                report.skippedGroup(new SkippedGroup(group.key().toString(), UNEXPECTED_ERROR_KIND, String.valueOf(e.getMessage())));
            }
        }

        ConversionReport result = report.finishedAt(clock.instant()).build();
        logSummary(result);
        if (config.getReportFileName() != null) {
            reportWriter.write(result, config.getOutputDirectory().resolve(config.getReportFileName()));
        }
        return result;
    }

    private void logSummary(ConversionReport report) {
        log.info("==============================");
        log.info("Conversiones completadas. Resultados:");
        log.info("==============================");
        report.producedArtifacts().forEach(name -> log.info("  {}", name));
        report.skippedGroups().forEach(skipped ->
                log.warn("  DESCARTADO {} [{}]: {}", skipped.groupKey(), skipped.errorKind(), skipped.reason()));
        report.rejectedFiles().forEach(rejected ->
                log.warn("  RECHAZADO {}: {}", rejected.fileName(), rejected.reason()));
        log.info("Producidas: {} | Descartados: {} | Rechazados: {}",
                report.producedArtifacts().size(), report.skippedGroups().size(), report.rejectedFiles().size());
    }

    @Override
    public void close() {
        if (processor != null) {
            processor.close();
            log.info("GridConversionOrchestrator cerrado.");
        }
    }
}
