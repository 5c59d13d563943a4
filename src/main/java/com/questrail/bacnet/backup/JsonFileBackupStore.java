package com.questrail.bacnet.backup;

import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.api.PropertyIdentifier;
import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.device.ConfigBackup;
import com.questrail.bacnet.device.DeviceTunables;
import com.questrail.bacnet.error.ConfigurationException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JsonFileBackupStore
 * =============================================================================
 * {@link BackupStore} keeping one JSON document on disk.
 *
 * <p>Saving writes a sibling temporary file and moves it over the target, so a
 * crash mid-save leaves the previous snapshot intact. Property values are
 * written with type tags (see {@link PropertyValueJson}) and read back with
 * the same Java types.</p>
 *
 * <p>I/O failures surface as {@link UncheckedIOException}; a document that
 * parses but does not describe a backup raises {@link ConfigurationException}.</p>
 */
public final class JsonFileBackupStore implements BackupStore
{
    private static final Logger log = LoggerFactory.getLogger(JsonFileBackupStore.class);

    public static final String DEFAULT_FILE_NAME = "bacnet-node-backup.json";
    static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileBackupStore(Path file) {
        this(file, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonFileBackupStore(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Path file() {
        return file;
    }

    @Override
    public void save(ConfigBackup backup) {
        Objects.requireNonNull(backup, "backup");
        ObjectNode root = toJson(backup);
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), root);
                move(tmp);
            }
            finally {
                Files.deleteIfExists(tmp);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("cannot write backup " + file, e);
        }
        log.info("Saved backup of device {} ({} object(s)) to {}",
                backup.config().deviceId(), backup.objects().size(), file);
    }

    private void move(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Optional<ConfigBackup> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        }
        catch (IOException e) {
            throw new UncheckedIOException("cannot read backup " + file, e);
        }
        try {
            return Optional.of(fromJson(root));
        }
        catch (IllegalArgumentException e) {
            throw new ConfigurationException("malformed backup " + file + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Mapping
    // ---------------------------------------------------------------------

    ObjectNode toJson(ConfigBackup backup) {
        ObjectNode root = mapper.createObjectNode();
        root.put("format", FORMAT_VERSION);

        LocalDeviceConfig c = backup.config();
        ObjectNode config = root.putObject("config");
        config.put("deviceId", c.deviceId());
        config.put("broadcastAddress", c.broadcastAddress());
        config.put("port", c.port());
        config.put("destinationPort", c.destinationPort());
        config.put("localAddress", c.localAddress());
        config.put("timeout", c.timeout());
        config.put("apduTimeout", c.apduTimeout());
        config.put("retries", c.retries());
        config.put("segTimeout", c.segTimeout());
        config.put("segWindow", c.segWindow());

        DeviceTunables t = backup.tunables();
        ObjectNode tunables = root.putObject("tunables");
        tunables.put("retries", t.retries());
        tunables.put("timeout", t.timeout());
        tunables.put("segTimeout", t.segTimeout());
        tunables.put("segWindow", t.segWindow());

        ArrayNode objects = root.putArray("objects");
        for (ObjectRecord record : backup.objects()) {
            ObjectNode o = objects.addObject();
            o.set("objectIdentifier", PropertyValueJson.writeIdentifier(record.objectIdentifier()));
            ObjectNode props = o.putObject("properties");
            record.properties().forEach((id, value) -> props.set(id.name(), PropertyValueJson.write(value)));
        }
        return root;
    }

    ConfigBackup fromJson(JsonNode root) {
        int format = PropertyValueJson.required(root, "format").intValue();
        if (format != FORMAT_VERSION) {
            throw new IllegalArgumentException("unsupported backup format " + format);
        }

        JsonNode c = PropertyValueJson.required(root, "config");
        LocalDeviceConfig config = LocalDeviceConfig.builder()
                .withDeviceId(intField(c, "deviceId"))
                .withBroadcastAddress(PropertyValueJson.required(c, "broadcastAddress").asText())
                .withPort(intField(c, "port"))
                .withDestinationPort(intField(c, "destinationPort"))
                .withLocalAddress(textOrNull(c, "localAddress"))
                .withTimeout(intField(c, "timeout"))
                .withApduTimeout(c.hasNonNull("apduTimeout") ? c.get("apduTimeout").intValue() : null)
                .withRetries(intField(c, "retries"))
                .withSegTimeout(intField(c, "segTimeout"))
                .withSegWindow(intField(c, "segWindow"))
                .build();

        JsonNode t = PropertyValueJson.required(root, "tunables");
        DeviceTunables tunables = new DeviceTunables(intField(t, "retries"), intField(t, "timeout"),
                intField(t, "segTimeout"), intField(t, "segWindow"));

        List<ObjectRecord> objects = new ArrayList<>();
        for (JsonNode o : PropertyValueJson.required(root, "objects")) {
            Map<PropertyIdentifier, Object> props = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = PropertyValueJson.required(o, "properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                props.put(PropertyIdentifier.of(e.getKey()), PropertyValueJson.read(e.getValue()));
            }
            objects.add(ObjectRecord.of(PropertyValueJson.readIdentifier(
                    PropertyValueJson.required(o, "objectIdentifier")), props));
        }
        return new ConfigBackup(config, tunables, objects);
    }

    private static int intField(JsonNode node, String field) {
        JsonNode value = PropertyValueJson.required(node, field);
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException("field '" + field + "' is not an integer");
        }
        return value.intValue();
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
