package phoenixgrid.pipeline;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.config.ConversionConfig;
import phoenixgrid.domain.exception.DuplicateGravityCodeException;
import phoenixgrid.domain.exception.InvalidGravityCodeException;
import phoenixgrid.domain.exception.PhoenixGridException;
import phoenixgrid.domain.grid.OutputGrid;
import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.model.ModelFile;
import phoenixgrid.domain.model.ModelGroup;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.domain.spectrum.CleanedSpectrum;
import phoenixgrid.domain.spectrum.RawSpectrum;
import phoenixgrid.domain.spectrum.ResampledSpectrum;
import phoenixgrid.factory.OutputGridFactory;
import phoenixgrid.factory.ResamplerFactory;
import phoenixgrid.io.SpectrumTextReader;
import phoenixgrid.spectral.i.ISpectrumResampler;
import phoenixgrid.spectral.impl.ResampleTask;
import phoenixgrid.spectral.impl.SpectrumCleaner;
import phoenixgrid.spectral.impl.SpectrumLoadTask;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Convierte un grupo completo: carga -> limpieza -> remuestreo -> ensamblado.
 * <p>
 * Responsabilidades:
 * 1. Validar las gravedades del grupo antes de tocar disco.
 * 2. Leer los ficheros en paralelo sobre el pool y esperar a todos (barrera).
 * 3. Remuestrear las doce gravedades en paralelo y reasociarlas por gravedad.
 * 4. Producir la {@link OutputGrid} con {@link OutputGridFactory}.
 * <p>
 * Ninguna tarea escribe estado compartido: cada una devuelve su propio resultado y la mezcla
 * ocurre en el hilo que llama, después de {@code invokeAll}.
 */
@Slf4j
public class GroupConversionProcessor implements AutoCloseable {

    private final ExecutorService threadPool;
    private final SpectrumTextReader reader;
    private final SpectrumCleaner cleaner;
    private final ISpectrumResampler resampler;
    private final OutputGridFactory outputGridFactory;

    public GroupConversionProcessor(ConversionConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param clock Reloj de la tarjeta CREATED, el mismo que usa el orquestador para el informe.
     */
    public GroupConversionProcessor(ConversionConfig config, Clock clock) {
        this(config,
                new SpectrumTextReader(),
                new SpectrumCleaner(),
                ResamplerFactory.create(config.getResamplingStrategy()),
                new OutputGridFactory(config.getHeaderMetadata(), clock));
    }

    public GroupConversionProcessor(ConversionConfig config,
                                    SpectrumTextReader reader,
                                    SpectrumCleaner cleaner,
                                    ISpectrumResampler resampler,
                                    OutputGridFactory outputGridFactory) {
        this.reader = reader;
        this.cleaner = cleaner;
        this.resampler = resampler;
        this.outputGridFactory = outputGridFactory;
        int workerThreads = Math.max(config.getWorkerThreads(), 1);
        this.threadPool = Executors.newFixedThreadPool(workerThreads);
        log.info("GroupConversionProcessor inicializado. (Hilos: {}, Remuestreo: {})", workerThreads, resampler.getName());
    }

    /**
     * @param group Grupo a convertir.
     * @param grid  Rejilla canónica compartida.
     * @return La tabla del grupo, aún sin escribir.
     * @throws PhoenixGridException si el grupo no se puede convertir.
     * @throws UncheckedIOException si falla la lectura de algún fichero.
     */
    public OutputGrid process(ModelGroup group, CanonicalGrid grid) {
        long startTime = System.currentTimeMillis();

        List<RawSpectrum> raw = loadSpectra(group);
        List<CleanedSpectrum> cleaned = cleaner.cleanGroup(group.key(), raw);
        List<ResampledSpectrum> resampled = resample(cleaned, grid);
        OutputGrid output = outputGridFactory.create(group.key(), grid, resampled);

        log.info("Grupo {} convertido en {} ms", group.key(), System.currentTimeMillis() - startTime);
        return output;
    }

    // --- CARGA ---

    List<RawSpectrum> loadSpectra(ModelGroup group) {
        Map<GravityCode, ModelFile> byGravity = resolveGravities(group);

        List<SpectrumLoadTask> tasks = new ArrayList<>(byGravity.size());
        byGravity.forEach((gravity, model) -> {
            log.info("Recuperando datos para log g = {} ({})", gravity.getCode(), model.fileName());
            tasks.add(new SpectrumLoadTask(model, gravity, reader));
        });

        List<RawSpectrum> spectra = invokeAll(tasks, "carga");
        log.debug("Grupo {}: {} ficheros cargados", group.key(), spectra.size());
        return spectra;
    }

    /**
     * Valida todas las gravedades del grupo. Un solo código desconocido o repetido invalida el grupo entero.
     */
    Map<GravityCode, ModelFile> resolveGravities(ModelGroup group) {
        Map<GravityCode, ModelFile> byGravity = new EnumMap<>(GravityCode.class);
        for (ModelFile model : group.files()) {
            GravityCode gravity = GravityCode.fromCode(model.gravityCode())
                    .orElseThrow(() -> new InvalidGravityCodeException(model.path(), model.gravityCode()));
            ModelFile previous = byGravity.putIfAbsent(gravity, model);
            if (previous != null) {
                throw new DuplicateGravityCodeException(gravity, previous.path(), model.path());
            }
        }
        return byGravity;
    }

    // --- REMUESTREO ---

    List<ResampledSpectrum> resample(List<CleanedSpectrum> cleaned, CanonicalGrid grid) {
        List<ResampleTask> tasks = new ArrayList<>(cleaned.size());
        for (CleanedSpectrum spectrum : cleaned) {
            tasks.add(new ResampleTask(spectrum, grid, resampler));
        }
        log.info("Remuestreando {} espectros sobre la rejilla canónica", tasks.size());
        return invokeAll(tasks, "remuestreo");
    }

    // --- HELPERS ---

    /**
     * Ejecuta las tareas y espera a todas. Devuelve los resultados en el orden de las tareas;
     * el primer fallo (en ese orden) se relanza tras la barrera.
     */
    private <T> List<T> invokeAll(List<? extends Callable<T>> tasks, String phase) {
        List<Future<T>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhoenixGridException("Fase de " + phase + " interrumpida.", e);
        }

        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PhoenixGridException("Fase de " + phase + " interrumpida.", e);
            } catch (ExecutionException e) {
                throw unwrap(e.getCause(), phase);
            }
        }
        return results;
    }

    private RuntimeException unwrap(Throwable cause, String phase) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof IOException) {
            return new UncheckedIOException((IOException) cause);
        }
        return new PhoenixGridException("Error en la fase de " + phase, cause);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("GroupConversionProcessor cerrado.");
    }
}
