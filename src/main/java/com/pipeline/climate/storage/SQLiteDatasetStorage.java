package com.pipeline.climate.storage;

import com.pipeline.climate.core.DatasetStorage;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.time.CalendarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.sql.*;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 基于SQLite的数据集存储实现。
 *
 * 核心设计：
 * - 所有数据集存放在存储根目录下的单个库文件中
 * - 变量与坐标的数值以小端 float64 BLOB 存储，时间坐标以日期文本加历法存储
 * - 属性以 (键, 类型, 文本值) 存储，数据集级属性的变量名与坐标名为空串
 * - 写入在单个事务中完成，同名数据集整体替换
 */
public class SQLiteDatasetStorage implements DatasetStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteDatasetStorage.class);

    private static final String DB_FILE = "datasets.db";
    private static final String LIST_SEPARATOR = ",";
    private static final String DATE_SEPARATOR = "\n";

    /** 存储根目录 */
    private final String storageRoot;

    /** 时间坐标未记录历法时采用的历法 */
    private final CalendarType defaultCalendar;

    private Connection connection;

    public SQLiteDatasetStorage(String storageRoot) {
        this(storageRoot, CalendarType.STANDARD);
    }

    public SQLiteDatasetStorage(String storageRoot, CalendarType defaultCalendar) {
        this.storageRoot = storageRoot;
        this.defaultCalendar = defaultCalendar;

        // 确保存储目录存在
        File dir = new File(storageRoot);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new RuntimeException("Failed to create storage directory: " + storageRoot);
        }

        initDatabase();
        log.info("SQLiteDatasetStorage initialized. Root: {}", storageRoot);
    }

    private void initDatabase() {
        try {
            String dbPath = storageRoot + File.separator + DB_FILE;
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);

            // 启用WAL模式
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("PRAGMA foreign_keys=ON");

                stmt.execute("CREATE TABLE IF NOT EXISTS datasets ("
                        + "name TEXT PRIMARY KEY, "
                        + "created_at INTEGER NOT NULL)");
                stmt.execute("CREATE TABLE IF NOT EXISTS variables ("
                        + "dataset TEXT NOT NULL REFERENCES datasets(name) ON DELETE CASCADE, "
                        + "name TEXT NOT NULL, "
                        + "position INTEGER NOT NULL, "
                        + "dims TEXT NOT NULL, "
                        + "shape TEXT NOT NULL, "
                        + "data BLOB NOT NULL, "
                        + "PRIMARY KEY (dataset, name))");
                stmt.execute("CREATE TABLE IF NOT EXISTS coordinates ("
                        + "dataset TEXT NOT NULL REFERENCES datasets(name) ON DELETE CASCADE, "
                        + "variable TEXT NOT NULL, "
                        + "name TEXT NOT NULL, "
                        + "position INTEGER NOT NULL, "
                        + "dims TEXT NOT NULL, "
                        + "shape TEXT NOT NULL, "
                        + "data BLOB, "
                        + "dates TEXT, "
                        + "calendar TEXT, "
                        + "PRIMARY KEY (dataset, variable, name))");
                stmt.execute("CREATE TABLE IF NOT EXISTS attributes ("
                        + "dataset TEXT NOT NULL REFERENCES datasets(name) ON DELETE CASCADE, "
                        + "variable TEXT NOT NULL DEFAULT '', "
                        + "coordinate TEXT NOT NULL DEFAULT '', "
                        + "key TEXT NOT NULL, "
                        + "type TEXT NOT NULL, "
                        + "value TEXT, "
                        + "PRIMARY KEY (dataset, variable, coordinate, key))");
            }
        } catch (SQLException e) {
            log.error("Failed to initialize dataset database: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to initialize dataset database", e);
        }
    }

    // ==================== 写入 ====================

    @Override
    public void write(String name, LabeledDataset dataset) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dataset name must not be null or blank");
        }

        try {
            connection.setAutoCommit(false);
            try {
                deleteRows(name);
                try (PreparedStatement stmt = connection.prepareStatement(
                        "INSERT INTO datasets (name, created_at) VALUES (?, ?)")) {
                    stmt.setString(1, name);
                    stmt.setLong(2, System.currentTimeMillis());
                    stmt.executeUpdate();
                }
                insertAttributes(name, "", "", dataset.getAttributes());

                int position = 0;
                for (LabeledArray variable : dataset.getVariables()) {
                    insertVariable(name, variable, position++);
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            log.info("Dataset '{}' written with {} variable(s).", name, dataset.size());
        } catch (SQLException e) {
            log.error("Failed to write dataset '{}': {}", name, e.getMessage(), e);
            throw new RuntimeException("Failed to write dataset " + name, e);
        }
    }

    private void insertVariable(String dataset, LabeledArray variable, int position) throws SQLException {
        String sql = "INSERT INTO variables (dataset, name, position, dims, shape, data) VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, dataset);
            stmt.setString(2, variable.getName());
            stmt.setInt(3, position);
            stmt.setString(4, String.join(LIST_SEPARATOR, variable.getDims()));
            stmt.setString(5, joinShape(variable.getShape()));
            stmt.setBytes(6, encode(variable.getValues()));
            stmt.executeUpdate();
        }
        insertAttributes(dataset, variable.getName(), "", variable.getAttributes());

        String coordSql = "INSERT INTO coordinates (dataset, variable, name, position, dims, shape, data, dates, calendar) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(coordSql)) {
            int coordPosition = 0;
            for (Coordinate coordinate : variable.getCoordinates().values()) {
                if (coordinate.isPositional()) {
                    continue; // 读取时自动重建
                }
                stmt.setString(1, dataset);
                stmt.setString(2, variable.getName());
                stmt.setString(3, coordinate.getName());
                stmt.setInt(4, coordPosition++);
                stmt.setString(5, String.join(LIST_SEPARATOR, coordinate.getDims()));
                stmt.setString(6, joinShape(coordinate.getShape()));
                if (coordinate.isTime()) {
                    stmt.setNull(7, Types.BLOB);
                    stmt.setString(8, coordinate.getDates().stream()
                            .map(CalendarDate::toString)
                            .collect(Collectors.joining(DATE_SEPARATOR)));
                    stmt.setString(9, coordinate.getCalendar().getCfName());
                } else {
                    stmt.setBytes(7, encode(coordinate.getValues()));
                    stmt.setNull(8, Types.VARCHAR);
                    stmt.setNull(9, Types.VARCHAR);
                }
                stmt.addBatch();
                insertAttributes(dataset, variable.getName(), coordinate.getName(), coordinate.getAttributes());
            }
            stmt.executeBatch();
        }
    }

    private void insertAttributes(String dataset, String variable, String coordinate,
                                  Map<String, Object> attributes) throws SQLException {
        if (attributes == null || attributes.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO attributes (dataset, variable, coordinate, key, type, value) VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (Map.Entry<String, Object> entry : attributes.entrySet()) {
                stmt.setString(1, dataset);
                stmt.setString(2, variable);
                stmt.setString(3, coordinate);
                stmt.setString(4, entry.getKey());
                stmt.setString(5, AttributeCodec.typeOf(entry.getValue()));
                stmt.setString(6, AttributeCodec.format(entry.getValue()));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    // ==================== 读取 ====================

    @Override
    public Optional<LabeledDataset> read(String name) {
        try {
            if (!exists(name)) {
                return Optional.empty();
            }
            Map<String, Map<String, Object>> attributes = loadAttributes(name);
            LabeledDataset.Builder builder = LabeledDataset.builder()
                    .attributes(attributes.getOrDefault(attributeKey("", ""), Collections.emptyMap()));

            String sql = "SELECT name, dims, shape, data FROM variables WHERE dataset = ? ORDER BY position";
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, name);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        String variableName = rs.getString("name");
                        LabeledArray.Builder array = LabeledArray.builder(variableName)
                                .dims(splitList(rs.getString("dims")))
                                .shape(splitShape(rs.getString("shape")))
                                .values(decode(rs.getBytes("data")))
                                .attributes(attributes.getOrDefault(attributeKey(variableName, ""),
                                        Collections.emptyMap()));
                        for (Coordinate coordinate : loadCoordinates(name, variableName, attributes)) {
                            array.coordinate(coordinate);
                        }
                        builder.variable(array.build());
                    }
                }
            }
            return Optional.of(builder.build());
        } catch (SQLException e) {
            log.error("Failed to read dataset '{}': {}", name, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private List<Coordinate> loadCoordinates(String dataset, String variable,
                                             Map<String, Map<String, Object>> attributes) throws SQLException {
        List<Coordinate> result = new ArrayList<>();
        String sql = "SELECT name, dims, shape, data, dates, calendar FROM coordinates "
                + "WHERE dataset = ? AND variable = ? ORDER BY position";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, dataset);
            stmt.setString(2, variable);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String coordName = rs.getString("name");
                    List<String> dims = splitList(rs.getString("dims"));
                    String dates = rs.getString("dates");
                    Coordinate coordinate;
                    if (dates != null) {
                        List<CalendarDate> parsed = new ArrayList<>();
                        for (String text : dates.split(DATE_SEPARATOR)) {
                            parsed.add(CalendarDate.parse(text));
                        }
                        String calendar = rs.getString("calendar");
                        coordinate = Coordinate.time(coordName, dims.get(0), parsed,
                                calendar == null ? defaultCalendar : CalendarType.fromName(calendar));
                    } else {
                        coordinate = Coordinate.grid(coordName, dims, splitShape(rs.getString("shape")),
                                decode(rs.getBytes("data")));
                    }
                    Map<String, Object> coordAttributes = attributes.get(attributeKey(variable, coordName));
                    if (coordAttributes != null) {
                        coordinate = coordinate.withAttributes(coordAttributes);
                    }
                    result.add(coordinate);
                }
            }
        }
        return result;
    }

    private Map<String, Map<String, Object>> loadAttributes(String dataset) throws SQLException {
        Map<String, Map<String, Object>> result = new HashMap<>();
        // rowid 顺序即写入顺序
        String sql = "SELECT variable, coordinate, key, type, value FROM attributes WHERE dataset = ? ORDER BY rowid";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, dataset);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.computeIfAbsent(attributeKey(rs.getString("variable"), rs.getString("coordinate")),
                                    k -> new LinkedHashMap<>())
                            .put(rs.getString("key"), AttributeCodec.parse(rs.getString("type"), rs.getString("value")));
                }
            }
        }
        return result;
    }

    private static String attributeKey(String variable, String coordinate) {
        return variable + "/" + coordinate;
    }

    private boolean exists(String name) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement("SELECT 1 FROM datasets WHERE name = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    // ==================== 管理 ====================

    @Override
    public boolean delete(String name) {
        try {
            boolean existed = exists(name);
            deleteRows(name);
            if (existed) {
                log.info("Dataset '{}' deleted.", name);
            }
            return existed;
        } catch (SQLException e) {
            log.error("Failed to delete dataset '{}': {}", name, e.getMessage(), e);
            return false;
        }
    }

    private void deleteRows(String name) throws SQLException {
        for (String table : List.of("attributes", "coordinates", "variables", "datasets")) {
            String column = "datasets".equals(table) ? "name" : "dataset";
            try (PreparedStatement stmt = connection.prepareStatement(
                    "DELETE FROM " + table + " WHERE " + column + " = ?")) {
                stmt.setString(1, name);
                stmt.executeUpdate();
            }
        }
    }

    @Override
    public List<String> listDatasets() {
        List<String> names = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT name FROM datasets ORDER BY name")) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        } catch (SQLException e) {
            log.error("Failed to list datasets: {}", e.getMessage(), e);
        }
        return names;
    }

    @Override
    public void shutdown() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            log.warn("Error closing dataset database: {}", e.getMessage());
        }
        log.info("SQLiteDatasetStorage shut down.");
    }

    // ==================== 编码 ====================

    static byte[] encode(double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : values) {
            buffer.putDouble(v);
        }
        return buffer.array();
    }

    static double[] decode(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        double[] values = new double[bytes.length / Double.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getDouble();
        }
        return values;
    }

    private static String joinShape(int[] shape) {
        return Arrays.stream(shape).mapToObj(String::valueOf).collect(Collectors.joining(LIST_SEPARATOR));
    }

    private static int[] splitShape(String text) {
        if (text == null || text.isEmpty()) {
            return new int[0];
        }
        return Arrays.stream(text.split(LIST_SEPARATOR)).mapToInt(Integer::parseInt).toArray();
    }

    private static List<String> splitList(String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(text.split(LIST_SEPARATOR)));
    }
}
