package edge.utils;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class LoggingUtil {

    public static final String LOG_OUTPUT_DIRECTORY_KEY = "log-path";
    public static final String DEFAULT_CONFIG_RESOURCE = "logback-edge.xml";
    public static final String CONSOLE_APPENDER_NAME = "console";

    /**
     * Reconfigures logback for a run so that the log file lands in {@code outputDirectory}. The
     * configuration comes from the {@code logback.configurationFile} system property when set, else
     * from {@value #DEFAULT_CONFIG_RESOURCE}.
     *
     * @return false if the configuration resource is not on the classpath
     */
    public static boolean initLogger(String outputDirectory, boolean keepConsoleAppenderOn) throws JoranException, IOException {
        String logbackConfigFile = System.getProperty(ContextInitializer.CONFIG_FILE_PROPERTY, DEFAULT_CONFIG_RESOURCE);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        try (InputStream resourceAsStream = LoggingUtil.class.getClassLoader().getResourceAsStream(logbackConfigFile)) {
            if (resourceAsStream == null) {
                LoggerFactory.getLogger(LoggingUtil.class)
                        .warn("Could not find resource '{}' in classpath. Keeping the default logger setup", logbackConfigFile);
                return false;
            }
            context.reset();
            context.putProperty(LOG_OUTPUT_DIRECTORY_KEY, outputDirectory);

            JoranConfigurator jc = new JoranConfigurator();
            jc.setContext(context);
            jc.doConfigure(resourceAsStream);
            if (!keepConsoleAppenderOn) {
                Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
                root.detachAppender(CONSOLE_APPENDER_NAME);
            }
            return true;
        }
    }
}
