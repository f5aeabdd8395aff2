package ca.gc.cra.safekeeper.infrastructure.persistence;

import ca.gc.cra.safekeeper.application.port.LedgerStatePort;
import ca.gc.cra.safekeeper.domain.escrow.FeePolicy;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.LedgerSnapshot;
import ca.gc.cra.safekeeper.domain.escrow.LedgerState;
import ca.gc.cra.safekeeper.domain.escrow.Treasure;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> {@link LedgerStatePort} that keeps the ledger in a single YAML document.
 * <p><strong>Why:</strong> Each CLI invocation is a separate process; the document carries the treasure table, both
 * index tables, counters, and payout balances between invocations.</p>
 * <p><strong>Role:</strong> Persistence adapter.</p>
 * <p><strong>Thread-safety:</strong> Not safe for concurrent writers across processes; a save replaces the file
 * atomically where the filesystem supports it.</p>
 * <p><strong>Observability:</strong> Logs loads and saves at DEBUG.</p>
 *
 * <p>Amounts are stored as decimal strings. The index tables are written for operators and verified against
 * the treasure table on load.</p>
 *
 * @since 0.1.0
 */
public final class YamlLedgerStateStore implements LedgerStatePort {
  private static final Logger log = LoggerFactory.getLogger(YamlLedgerStateStore.class);
  static final int FORMAT_VERSION = 1;

  private final Path path;

  /**
   * Creates a store bound to {@code path}.
   *
   * @param path state file location; must not be {@code null}
   */
  public YamlLedgerStateStore(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  /**
   * Returns the bound state file.
   *
   * @return path
   */
  public Path path() {
    return path;
  }

  @Override
  public Optional<StoredLedger> load() throws IOException {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse ledger state at " + path, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("Ledger state at " + path + " is empty");
    }
    Map<String, Object> root = asMap(document, "root");
    long version = asLong(root.get("version"), "version");
    if (version != FORMAT_VERSION) {
      throw new IllegalArgumentException("Unsupported ledger state version " + version + " in " + path);
    }
    LedgerSnapshot snapshot = readSnapshot(asMap(root.get("ledger"), "ledger"));
    Map<Identity, BigInteger> payouts = new LinkedHashMap<>();
    Object payoutNode = root.get("payouts");
    if (payoutNode != null) {
      for (Map.Entry<String, Object> entry : asMap(payoutNode, "payouts").entrySet()) {
        payouts.put(Identity.of(entry.getKey()), asAmount(entry.getValue(), "payouts." + entry.getKey()));
      }
    }
    log.debug("Loaded ledger state from {}: {} treasures", path, snapshot.treasures().size());
    return Optional.of(new StoredLedger(snapshot, payouts));
  }

  @Override
  public void save(StoredLedger ledger) throws IOException {
    Objects.requireNonNull(ledger, "ledger");
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", FORMAT_VERSION);
    root.put("ledger", writeSnapshot(ledger.snapshot()));
    Map<String, Object> payouts = new TreeMap<>();
    for (Map.Entry<Identity, BigInteger> entry : ledger.payouts().entrySet()) {
      payouts.put(entry.getKey().address(), entry.getValue().toString());
    }
    root.put("payouts", payouts);

    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setPrettyFlow(true);

    Path absolute = path.toAbsolutePath();
    Path directory = absolute.getParent();
    if (directory != null) {
      Files.createDirectories(directory);
    }
    Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
    try {
      try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        new Yaml(options).dump(root, writer);
      }
      replace(tmp, absolute);
    } catch (IOException | RuntimeException ex) {
      Files.deleteIfExists(tmp);
      throw ex;
    }
    log.debug("Saved ledger state to {}: {} treasures", absolute, ledger.snapshot().treasures().size());
  }

  private static void replace(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing non-atomically", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static Map<String, Object> writeSnapshot(LedgerSnapshot snapshot) {
    Map<String, Object> ledger = new LinkedHashMap<>();
    ledger.put("nextTreasureId", snapshot.nextTreasureId());
    ledger.put("feeBasisPoints", snapshot.feeBasisPoints());
    ledger.put("feePolicy", snapshot.feePolicy().name());
    ledger.put("owner", snapshot.owner().address());
    ledger.put("collectedFees", snapshot.collectedFees().toString());
    ledger.put("heldValue", snapshot.heldValue().toString());
    List<Map<String, Object>> treasures = new ArrayList<>(snapshot.treasures().size());
    for (Treasure treasure : snapshot.treasures()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("id", treasure.id());
      row.put("amount", treasure.amount().toString());
      row.put("unlockTime", treasure.unlockTime());
      row.put("claimed", treasure.claimed());
      row.put("noble", treasure.noble().address());
      row.put("beneficiary", treasure.beneficiary().address());
      treasures.add(row);
    }
    ledger.put("treasures", treasures);

    LedgerState state = LedgerState.restore(snapshot);
    Map<String, Object> byNoble = new TreeMap<>();
    Map<String, Object> byBeneficiary = new TreeMap<>();
    for (Treasure treasure : snapshot.treasures()) {
      byNoble.computeIfAbsent(treasure.noble().address(), k -> state.idsByNoble(treasure.noble()));
      byBeneficiary.computeIfAbsent(
          treasure.beneficiary().address(), k -> state.idsByBeneficiary(treasure.beneficiary()));
    }
    Map<String, Object> index = new LinkedHashMap<>();
    index.put("byNoble", byNoble);
    index.put("byBeneficiary", byBeneficiary);
    ledger.put("index", index);
    return ledger;
  }

  private static LedgerSnapshot readSnapshot(Map<String, Object> ledger) {
    List<Treasure> treasures = new ArrayList<>();
    Object rows = ledger.get("treasures");
    if (rows != null) {
      if (!(rows instanceof List<?> list)) {
        throw new IllegalArgumentException("ledger.treasures must be a list");
      }
      for (Object row : list) {
        Map<String, Object> fields = asMap(row, "treasure");
        treasures.add(new Treasure(
            asLong(fields.get("id"), "treasure.id"),
            asAmount(fields.get("amount"), "treasure.amount"),
            asLong(fields.get("unlockTime"), "treasure.unlockTime"),
            asBoolean(fields.get("claimed"), "treasure.claimed"),
            asIdentity(fields.get("noble"), "treasure.noble"),
            asIdentity(fields.get("beneficiary"), "treasure.beneficiary")));
      }
    }
    LedgerSnapshot snapshot = new LedgerSnapshot(
        asLong(ledger.get("nextTreasureId"), "nextTreasureId"),
        asInt(ledger.get("feeBasisPoints"), "feeBasisPoints"),
        FeePolicy.fromString(asString(ledger.get("feePolicy"), "feePolicy")),
        asIdentity(ledger.get("owner"), "owner"),
        asAmount(ledger.get("collectedFees"), "collectedFees"),
        asAmount(ledger.get("heldValue"), "heldValue"),
        treasures);
    Object index = ledger.get("index");
    if (index != null) {
      verifyIndex(snapshot, asMap(index, "index"));
    }
    return snapshot;
  }

  private static void verifyIndex(LedgerSnapshot snapshot, Map<String, Object> index) {
    LedgerState state = LedgerState.restore(snapshot);
    verifyTable(index.get("byNoble"), "byNoble", state::idsByNoble);
    verifyTable(index.get("byBeneficiary"), "byBeneficiary", state::idsByBeneficiary);
  }

  private static void verifyTable(
      Object table, String name, Function<Identity, List<Long>> derived) {
    if (table == null) {
      return;
    }
    for (Map.Entry<String, Object> entry : asMap(table, "index." + name).entrySet()) {
      if (!(entry.getValue() instanceof List<?> ids)) {
        throw new IllegalArgumentException("index." + name + " entries must be lists");
      }
      List<Long> stored = new ArrayList<>(ids.size());
      for (Object id : ids) {
        stored.add(asLong(id, "index." + name));
      }
      if (!stored.equals(derived.apply(Identity.of(entry.getKey())))) {
        throw new IllegalArgumentException(
            "index." + name + " for " + entry.getKey() + " does not match the treasure table");
      }
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static long asLong(Object value, String field) {
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      if (big.bitLength() > 63) {
        throw new IllegalArgumentException(field + " is out of range (was " + big + ")");
      }
      return big.longValue();
    }
    if (value instanceof Number number) {
      throw new IllegalArgumentException(field + " must be an integer (was " + number + ")");
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(field + " must be an integer (was " + text + ")", ex);
      }
    }
    throw new IllegalArgumentException(field + " must be an integer");
  }

  private static int asInt(Object value, String field) {
    long parsed = asLong(value, field);
    if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(field + " is out of range (was " + parsed + ")");
    }
    return (int) parsed;
  }

  private static BigInteger asAmount(Object value, String field) {
    if (value instanceof BigInteger big) {
      return big;
    }
    if (value instanceof Integer || value instanceof Long) {
      return BigInteger.valueOf(((Number) value).longValue());
    }
    if (value instanceof String text) {
      try {
        return new BigInteger(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(field + " must be a whole number (was " + text + ")", ex);
      }
    }
    throw new IllegalArgumentException(field + " must be a whole number");
  }

  private static boolean asBoolean(Object value, String field) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    throw new IllegalArgumentException(field + " must be true or false");
  }

  private static String asString(Object value, String field) {
    if (value == null) {
      throw new IllegalArgumentException(field + " is required");
    }
    return value.toString();
  }

  private static Identity asIdentity(Object value, String field) {
    return Identity.of(asString(value, field));
  }
}
