package at.sv.energy;

import at.sv.energy.api.EnergyMeterApi;
import at.sv.energy.api.device.EnergyMeterApiImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.function.Function;

@Command(name = "EnergyMeterCli", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Reads and configures an energy meter device through its local API.")
public final class EnergyMeterCli {

    private static final Logger LOG = LoggerFactory.getLogger(EnergyMeterCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-H", "--host"}, paramLabel = "<host>",
            defaultValue = "${env:DEVICE_HOST}",
            description = "The IP address or host name of the device, optionally with a port. Example: 192.168.0.24")
    String host;
    @Option(names = "--timeout", paramLabel = "<seconds>",
            defaultValue = "${env:REQUEST_TIMEOUT:-10}",
            description = "The timeout for each request in seconds. Default: ${DEFAULT-VALUE} seconds.")
    int timeoutInSeconds;

    public static void main(String[] args) {
        int execute = new CommandLine(new EnergyMeterCli()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Command(name = "device", description = "Prints the product, serial and firmware of the device.")
    int device() {
        return execute(EnergyMeterApi::fetchDevice);
    }

    @Command(name = "features", description = "Prints the features supported by the device.")
    int features() {
        return execute(EnergyMeterApi::getFeatures);
    }

    @Command(name = "data", description = "Prints the current readings.")
    int data() {
        return execute(EnergyMeterApi::fetchMeteredData);
    }

    @Command(name = "state", description = "Prints the switch state, if the device has one.")
    int state() {
        return execute(api -> api.fetchSwitchState()
                                 .map(Object.class::cast)
                                 .orElse("Device has no switchable state"));
    }

    @Command(name = "set-state", description = "Updates the switch state. At least one option is required.")
    int setState(@Option(names = "--power-on", arity = "1", paramLabel = "<true|false>") Boolean powerOn,
                 @Option(names = "--switch-lock", arity = "1", paramLabel = "<true|false>") Boolean switchLock,
                 @Option(names = "--brightness", paramLabel = "<0-255>") Integer brightness) {
        return execute(api -> {
            api.setSwitchState(powerOn, switchLock, brightness);
            return "State updated";
        });
    }

    @Command(name = "system", description = "Prints the system settings.")
    int system() {
        return execute(EnergyMeterApi::fetchSystemSettings);
    }

    @Command(name = "set-system", description = "Updates the system settings.")
    int setSystem(@Option(names = "--cloud-enabled", arity = "1", paramLabel = "<true|false>") Boolean cloudEnabled) {
        return execute(api -> {
            api.setSystemSettings(cloudEnabled);
            return "System settings updated";
        });
    }

    @Command(name = "identify", description = "Lets the status light of the device blink.")
    int identify() {
        return execute(api -> {
            api.identify();
            return "Identify sent";
        });
    }

    @Command(name = "decryption", description = "Prints whether decryption key and AAD are configured.")
    int decryption() {
        return execute(EnergyMeterApi::fetchDecryptionStatus);
    }

    @Command(name = "set-decryption", description = "Sets the decryption key and/or AAD.")
    int setDecryption(@Option(names = "--key", paramLabel = "<32 hex chars>") String key,
                      @Option(names = "--aad", paramLabel = "<34 hex chars>") String aad) {
        return execute(api -> {
            api.setDecryptionKeys(key, aad);
            return "Decryption keys updated";
        });
    }

    @Command(name = "reset-decryption", description = "Clears the decryption key and/or AAD.")
    int resetDecryption(@Option(names = "--key", description = "Clear the key.") boolean key,
                        @Option(names = "--aad", description = "Clear the AAD.") boolean aad) {
        return execute(api -> {
            api.resetDecryptionKeys(key, aad);
            return "Decryption keys reset";
        });
    }

    private int execute(Function<EnergyMeterApi, Object> operation) {
        assertConfigurationParameters();
        MDC.put("context", "cli");
        try (EnergyMeterApi api = EnergyMeterApiImpl.create(host, Duration.ofSeconds(timeoutInSeconds))) {
            Object result = operation.apply(api);
            PrintWriter out = spec.commandLine().getOut();
            out.println(result);
            out.flush();
            return 0;
        } catch (RuntimeException e) {
            LOG.debug("Command failed", e);
            PrintWriter err = spec.commandLine().getErr();
            err.println(e.getMessage());
            err.flush();
            return 1;
        } finally {
            MDC.remove("context");
        }
    }

    private void assertConfigurationParameters() {
        if (host == null || host.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "No device host provided. Use --host or set DEVICE_HOST.");
        }
        if (timeoutInSeconds <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid timeout '" + timeoutInSeconds + "'. Must be at least 1 second.");
        }
    }
}
