package nl.nfi.cfglab.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

import java.nio.file.Path;
import java.nio.file.Paths;

import static nl.nfi.cfglab.common.HostUtils.hostname;

// registered through META-INF/services, only takes over when a log directory is requested
// (-DLOG_DIRECTORY_PATH=... or --log_directory_path), otherwise logback-test.xml / logback.xml / defaults apply
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    public static final String LOG_DIRECTORY_PROPERTY = "LOG_DIRECTORY_PATH";
    public static final String LOG_LEVEL_PROPERTY = "LOG_LEVEL";

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    private static final String BASE_PACKAGE = "nl.nfi.cfglab";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        final String logDirectory = System.getProperty(LOG_DIRECTORY_PROPERTY);
        if (logDirectory == null) {
            return ExecutionStatus.INVOKE_NEXT_IF_ANY;
        }

        setContext(loggerContext);
        setupLogger(BASE_PACKAGE, System.getProperty(LOG_LEVEL_PROPERTY, "DEBUG"), null);

        final Logger root = setupLogger(Logger.ROOT_LOGGER_NAME, "INFO", null);
        root.addAppender(createFileAppender(Paths.get(logDirectory)));

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    public static Path logFilePath(final Path logDirectory) {
        return logDirectory.resolve("cfg-lab-" + hostname() + ".log");
    }

    private Appender<ILoggingEvent> createFileAppender(final Path logDirectory) {
        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logFilePath(logDirectory).toString());

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectory.resolve("cfg-lab-" + hostname() + ".%d{yyyy-MM-dd}.%i.gz").toString());
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(7);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);

        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(LOG_PATTERN);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();

        appender.setEncoder(layoutEncoder);

        appender.start();
        return appender;
    }
}
