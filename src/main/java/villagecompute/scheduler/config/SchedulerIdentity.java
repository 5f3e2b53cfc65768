package villagecompute.scheduler.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * Identifies this scheduler process in execution records and lease ownership.
 *
 * <p>
 * Uses {@code scheduler.host-id} when configured, otherwise the local host name.
 */
@ApplicationScoped
public class SchedulerIdentity {

    private static final Logger LOG = Logger.getLogger(SchedulerIdentity.class);

    private final String hostId;

    @Inject
    public SchedulerIdentity(@ConfigProperty(
            name = "scheduler.host-id") Optional<String> configuredHostId) {
        this.hostId = configuredHostId.filter(id -> !id.isBlank()).orElseGet(SchedulerIdentity::localHostName);
        LOG.infof("Scheduler host id: %s", hostId);
    }

    public static SchedulerIdentity of(String hostId) {
        return new SchedulerIdentity(Optional.of(hostId));
    }

    public String hostId() {
        return hostId;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.warnf("Unable to resolve local host name, using 'localhost': %s", e.getMessage());
            return "localhost";
        }
    }
}
