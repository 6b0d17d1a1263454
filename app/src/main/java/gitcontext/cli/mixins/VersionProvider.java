package gitcontext.cli.mixins;

import picocli.CommandLine.IVersionProvider;
import java.io.InputStream;
import java.util.Properties;

public class VersionProvider implements IVersionProvider {

    static final String VERSION_RESOURCE = "/git-context-version.properties";

    @Override
    public String[] getVersion() throws Exception {
        Properties props = new Properties();
        try (InputStream is = getClass().getResourceAsStream(VERSION_RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        }

        String version = props.getProperty("version", "1.0.0-SNAPSHOT");

        return new String[] {
                "@|bold git-context|@ version @|green " + version + "|@",
                "Java: " + System.getProperty("java.version"),
                "JVM: " + System.getProperty("java.vm.name") + " " + System.getProperty("java.vm.version")
        };
    }
}
