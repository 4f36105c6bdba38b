package notestore.domain.logger;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Optional;
import java.util.logging.FileHandler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Produces a logger for each injection point. When notes.log.file is set, every produced logger also writes to
 * that file. The file is released when the container shuts down.
 */
@ApplicationScoped
public class Loggers {

    @Inject
    @ConfigProperty(name = "notes.log.file")
    private Optional<String> logFile;

    @Nullable
    private FileHandler fileHandler;

    @PostConstruct
    void init() {
        System.setProperty("java.util.logging.SimpleFormatter.format", "%1$tF %1$tT %4$s %3$s: %5$s%6$s%n");
        final SimpleFormatter formatter = new SimpleFormatter();
        this.fileHandler = logFile
                .flatMap(file -> Try.of(() -> new FileHandler(file, true))
                        .onFailure(ex -> Logger.getLogger(Loggers.class.getName())
                                .warning("Failed to open the log file " + file + ": " + ex.getMessage()))
                        .toJavaOptional())
                .map(handler -> {
                    handler.setFormatter(formatter);
                    return handler;
                })
                .orElse(null);
    }

    @PreDestroy
    void destroy() {
        if (fileHandler != null) {
            fileHandler.close();
            fileHandler = null;
        }
    }

    @Produces
    public Logger getLogger(final InjectionPoint injectionPoint) {
        final Logger logger = Logger.getLogger(
                injectionPoint.getMember().getDeclaringClass().getName());

        if (fileHandler != null && !Arrays.asList(logger.getHandlers()).contains(fileHandler)) {
            logger.addHandler(fileHandler);
        }

        return logger;
    }
}
