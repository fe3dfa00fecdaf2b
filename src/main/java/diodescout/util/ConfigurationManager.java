package diodescout.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

public class ConfigurationManager {
    private static final String configFilePath = "config.properties";
    // Properties is thread safe
    // https://docs.oracle.com/javase/8/docs/api/java/util/Properties.html
    private static Properties props;
    private static volatile ConfigurationManager instance;

    public static ConfigurationManager getInstance() {
        if (instance == null) {
            synchronized (ConfigurationManager.class) {
                if (instance == null)
                    instance = new ConfigurationManager();
            }
        }
        return instance;
    }

    private ConfigurationManager() {
        props = new Properties();
        try (InputStream ip = ConfigurationManager.class.getClassLoader()
                .getResourceAsStream(configFilePath)) {
            if (ip == null)
                throw new IOException(String.format("%s not found in the classpath", configFilePath));
            props.load(ip);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public int getReadChunkSize() {
        return Integer.parseInt(props.getProperty("readChunkSize"));
    }

    /**
     * @return the locale used for the csv export, the default format locale of the jvm
     * if the property is empty
     */
    public Locale getCsvExportLocale() {
        String languageTag = props.getProperty("csvExportLocale", "").trim();
        if (languageTag.isEmpty())
            return Locale.getDefault(Locale.Category.FORMAT);
        return Locale.forLanguageTag(languageTag);
    }

    public String getCsvExportFileName() {
        return props.getProperty("csvExportFileName");
    }

    public String getPythonExportFileName() {
        return props.getProperty("pythonExportFileName");
    }
}
