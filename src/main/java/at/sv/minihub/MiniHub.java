package at.sv.minihub;

import at.sv.minihub.automation.Automation;
import at.sv.minihub.automation.AutomationEngine;
import at.sv.minihub.automation.AutomationFileParser;
import at.sv.minihub.automation.AutomationService;
import at.sv.minihub.bus.EventBus;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.history.HistoryRecorder;
import at.sv.minihub.history.RetentionPurger;
import at.sv.minihub.integration.Integration;
import at.sv.minihub.integration.IntegrationManager;
import at.sv.minihub.integration.IntegrationSettings;
import at.sv.minihub.integration.VirtualIntegration;
import at.sv.minihub.live.LiveUpdateFanout;
import at.sv.minihub.model.EventFactory;
import at.sv.minihub.service.AreaService;
import at.sv.minihub.service.DeviceService;
import at.sv.minihub.service.EntityStateAuthority;
import at.sv.minihub.service.ServiceCallRouter;
import at.sv.minihub.storage.memory.InMemoryAreaRepository;
import at.sv.minihub.storage.memory.InMemoryAutomationRepository;
import at.sv.minihub.storage.memory.InMemoryDeviceRepository;
import at.sv.minihub.storage.memory.InMemoryEntityHistoryRepository;
import at.sv.minihub.storage.memory.InMemoryEntityRepository;
import at.sv.minihub.storage.memory.InMemoryEventStore;
import at.sv.minihub.time.SunTimesProviderImpl;
import at.sv.minihub.time.TimeOfDayResolver;
import at.sv.minihub.time.TimeOfDayResolverImpl;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Command(name = "MiniHub", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class MiniHub implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MiniHub.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--event-bus-capacity", paramLabel = "<events>",
            defaultValue = "${env:EVENT_BUS_CAPACITY:-256}",
            description = "The number of events the event bus retains for slow consumers. A consumer falling further " +
                          "behind skips the missed events. Default: ${DEFAULT-VALUE}")
    int eventBusCapacity;
    @Option(names = "--history-retention-days", paramLabel = "<days>",
            defaultValue = "${env:HISTORY_RETENTION_DAYS:-30}",
            description = "The number of days entity history is kept. Default: ${DEFAULT-VALUE} days.")
    int historyRetentionDays;
    @Option(names = "--history-purge-interval", paramLabel = "<hours>",
            defaultValue = "${env:HISTORY_PURGE_INTERVAL:-24}",
            description = "The interval in which expired entity history is deleted. Default: ${DEFAULT-VALUE} hours.")
    int historyPurgeIntervalInHours;
    @Option(names = "--fan-out-queue-capacity", paramLabel = "<events>",
            defaultValue = "${env:FAN_OUT_QUEUE_CAPACITY:-64}",
            description = "The number of events queued per streaming client before the client is disconnected. " +
                          "Default: ${DEFAULT-VALUE}")
    int fanOutQueueCapacity;
    @Option(names = "--time-pattern-tick", paramLabel = "<seconds>",
            defaultValue = "${env:TIME_PATTERN_TICK:-1}",
            description = "The interval in which time pattern triggers are evaluated. Default: ${DEFAULT-VALUE} seconds.")
    int timePatternTickInSeconds;
    @Option(names = "--service-call-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:SERVICE_CALL_TIMEOUT:-10}",
            description = "The maximum time an integration may take to handle a service call. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int serviceCallTimeoutInSeconds;
    @Option(names = "--integration-retry-delay", paramLabel = "<delay>",
            defaultValue = "${env:INTEGRATION_RETRY_DELAY:-10}",
            description = "The initial delay in seconds for retrying a failed connection-style integration task. " +
                          "Doubles with every consecutive failure. Default: ${DEFAULT-VALUE} seconds.")
    int integrationRetryDelayInSeconds;
    @Option(names = "--integration-max-backoff", paramLabel = "<delay>",
            defaultValue = "${env:INTEGRATION_MAX_BACKOFF:-300}",
            description = "The maximum retry delay for failed integration tasks. Default: ${DEFAULT-VALUE} seconds.")
    int integrationMaxBackoffInSeconds;
    @Option(names = "--virtual-integration",
            defaultValue = "${env:VIRTUAL_INTEGRATION:-true}",
            description = "Enables the simulated light, switch and temperature sensor. Default: ${DEFAULT-VALUE}")
    boolean virtualIntegration;
    @Option(names = "--virtual-sensor-interval", paramLabel = "<seconds>",
            defaultValue = "${env:VIRTUAL_SENSOR_INTERVAL:-60}",
            description = "The interval in which the virtual temperature sensor reports a new reading. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int virtualSensorIntervalInSeconds;
    @Option(names = "--lat",
            defaultValue = "${env:LAT:-0.0}",
            description = "The latitude of your location in degrees [-90..90], used for sun keywords in time ranges.")
    double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG:-0.0}",
            description = "The longitude of your location in degrees [-180..180], used for sun keywords in time ranges.")
    double longitude;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of your location, " +
                          "used to provide more accurate sunrise and sunset times.")
    double elevation;
    @Option(names = "--automations", paramLabel = "<file>",
            defaultValue = "${env:AUTOMATIONS_FILE}",
            description = "Optional JSON file with automations to create at startup.")
    Path automationsFile;

    private final Supplier<ZonedDateTime> currentTime = ZonedDateTime::now;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public static void main(String[] args) {
        int execute = new CommandLine(new MiniHub()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ObjectMapper objectMapper = JsonMappers.create();
        List<Automation> automations = readAutomations(objectMapper);

        ExecutorService workers = Executors.newCachedThreadPool();
        TaskSchedulerImpl scheduler = new TaskSchedulerImpl(Executors.newSingleThreadScheduledExecutor(), workers,
                currentTime);
        EventFactory eventFactory = new EventFactory(currentTime);
        EventBus bus = new EventBus(eventBusCapacity);

        InMemoryEntityRepository entityRepository = new InMemoryEntityRepository();
        InMemoryDeviceRepository deviceRepository = new InMemoryDeviceRepository();
        InMemoryAreaRepository areaRepository = new InMemoryAreaRepository();
        InMemoryAutomationRepository automationRepository = new InMemoryAutomationRepository();
        InMemoryEntityHistoryRepository historyRepository = new InMemoryEntityHistoryRepository();

        EntityStateAuthority authority = new EntityStateAuthority(entityRepository, deviceRepository, bus, eventFactory,
                currentTime);
        // admin surface for a transport layer
        DeviceService deviceService = new DeviceService(deviceRepository, areaRepository, authority);
        AreaService areaService = new AreaService(areaRepository, deviceRepository);
        TimeOfDayResolver timeOfDayResolver = new TimeOfDayResolverImpl(
                new SunTimesProviderImpl(latitude, longitude, elevation));
        AutomationService automationService = new AutomationService(automationRepository, timeOfDayResolver);
        createAutomations(automationService, automations);

        IntegrationManager integrationManager = new IntegrationManager(createIntegrations(), authority, bus, scheduler,
                workers, currentTime, new IntegrationSettings(Duration.ofSeconds(serviceCallTimeoutInSeconds),
                Duration.ofSeconds(integrationRetryDelayInSeconds), Duration.ofSeconds(integrationMaxBackoffInSeconds)));
        AutomationEngine engine = new AutomationEngine(bus, automationRepository, entityRepository,
                new ServiceCallRouter(authority, deviceRepository, integrationManager), timeOfDayResolver, scheduler,
                eventFactory, currentTime);
        HistoryRecorder recorder = new HistoryRecorder(bus, entityRepository, historyRepository, new InMemoryEventStore());
        LiveUpdateFanout fanout = new LiveUpdateFanout(bus, objectMapper, fanOutQueueCapacity);

        recorder.start();
        engine.start();
        fanout.start();
        scheduler.scheduleAtFixedRate(engine::onTick, timePatternTickInSeconds, timePatternTickInSeconds, TimeUnit.SECONDS);
        scheduler.scheduleAtFixedRate(new RetentionPurger(historyRepository, Duration.ofDays(historyRetentionDays), currentTime),
                0, historyPurgeIntervalInHours, TimeUnit.HOURS);
        integrationManager.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("context", "shutdown");
            LOG.info("Shutting down.");
            integrationManager.shutdown();
            engine.close();
            recorder.close();
            fanout.close();
            scheduler.shutdown(Duration.ofSeconds(5));
            stopped.countDown();
        }, "shutdown"));

        MDC.put("context", "init");
        LOG.info("Started with {} automations, {} areas, {} devices and {} entities.",
                automationService.list().size(), areaService.list().size(), deviceService.list().size(),
                authority.list().size());
        MDC.remove("context");
        awaitShutdown();
    }

    private List<Integration> createIntegrations() {
        List<Integration> integrations = new ArrayList<>();
        if (virtualIntegration) {
            integrations.add(new VirtualIntegration(Duration.ofSeconds(virtualSensorIntervalInSeconds),
                    () -> ThreadLocalRandom.current().nextDouble()));
        }
        return integrations;
    }

    private List<Automation> readAutomations(ObjectMapper objectMapper) {
        if (automationsFile == null) {
            return List.of();
        }
        if (!Files.isReadable(automationsFile)) {
            fail("Given automations file '" + automationsFile.toAbsolutePath() + "' does not exist or is not readable!");
        }
        try {
            return new AutomationFileParser(objectMapper).parse(Files.readString(automationsFile));
        } catch (ValidationException e) {
            fail("Failed to parse automations file '" + automationsFile.toAbsolutePath() + "': " + e.getMessage());
            return List.of();
        } catch (IOException e) {
            fail("Failed to read automations file '" + automationsFile.toAbsolutePath() + "': " + e.getMessage());
            return List.of();
        }
    }

    private void createAutomations(AutomationService automationService, List<Automation> automations) {
        for (Automation automation : automations) {
            try {
                automationService.create(automation);
            } catch (ValidationException e) {
                fail("Invalid automation '" + automation.getName() + "' in '" + automationsFile + "': " + e.getMessage());
            }
        }
    }

    private void awaitShutdown() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertCapacityConfigurations();
        assertTimingConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertCapacityConfigurations() {
        if (eventBusCapacity <= 0) {
            fail("--event-bus-capacity must be > 0");
        }
        if (fanOutQueueCapacity <= 0) {
            fail("--fan-out-queue-capacity must be > 0");
        }
    }

    private void assertTimingConfigurations() {
        if (historyRetentionDays <= 0) {
            fail("--history-retention-days must be > 0");
        }
        if (historyPurgeIntervalInHours <= 0) {
            fail("--history-purge-interval must be > 0");
        }
        if (timePatternTickInSeconds <= 0) {
            fail("--time-pattern-tick must be > 0");
        }
        if (serviceCallTimeoutInSeconds <= 0) {
            fail("--service-call-timeout must be > 0");
        }
        if (integrationRetryDelayInSeconds <= 0) {
            fail("--integration-retry-delay must be > 0");
        }
        if (integrationMaxBackoffInSeconds < integrationRetryDelayInSeconds) {
            fail("--integration-max-backoff must be >= --integration-retry-delay");
        }
        if (virtualSensorIntervalInSeconds <= 0) {
            fail("--virtual-sensor-interval must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
