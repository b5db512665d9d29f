package io.mnemo.core.graph;

import io.mnemo.core.model.Category;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.storage.PooledConnection;
import io.mnemo.core.storage.Rows;
import io.mnemo.core.storage.Sanitizer;
import io.mnemo.core.storage.StorageContext;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class CategoryOperations {
    private static final String INSERT = """
        INSERT INTO knowledge_categories (name, priority, retention_days, created_at) VALUES (?, ?, ?, ?)
        """;
    private static final String FIND_BY_NAME = """
        SELECT id, name, priority, retention_days FROM knowledge_categories WHERE name = ?
        """;
    private static final String EXISTS = "SELECT 1 FROM knowledge_categories WHERE id = ?";
    private static final String LIST = """
        SELECT id, name, priority, retention_days FROM knowledge_categories ORDER BY priority DESC, name
        """;

    private final StorageContext context;

    public CategoryOperations(StorageContext context) {
        this.context = context;
    }

    public StoreResult<Category> createCategory(String name, int priority, Integer retentionDays) {
        String categoryName = Sanitizer.identity(name);
        if (categoryName.isEmpty()) {
            return StoreResult.failure(StoreError.invalidArgument("category name must not be empty"));
        }
        if (priority < 1 || priority > 5) {
            return StoreResult.failure(StoreError.invalidArgument("priority must be between 1 and 5"));
        }
        if (retentionDays != null && retentionDays <= 0) {
            return StoreResult.failure(StoreError.invalidArgument("retentionDays must be > 0"));
        }
        return context.write("create_category", handle -> {
            if (!find(handle, categoryName).isEmpty()) {
                return StoreResult.failure(StoreError.invalidArgument("Category already exists: " + categoryName));
            }
            PreparedStatement insert = handle.prepare(INSERT);
            insert.setString(1, categoryName);
            insert.setInt(2, priority);
            Rows.setNullableInt(insert, 3, retentionDays);
            insert.setLong(4, context.clock().millis());
            insert.executeUpdate();
            return StoreResult.ok(find(handle, categoryName).get(0));
        });
    }

    public StoreResult<List<Category>> listCategories() {
        return context.read("list_categories", handle -> StoreResult.ok(categories(handle.prepare(LIST))));
    }

    static boolean exists(PooledConnection handle, int id) throws SQLException {
        PreparedStatement statement = handle.prepare(EXISTS);
        statement.setInt(1, id);
        try (ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next();
        }
    }

    private List<Category> find(PooledConnection handle, String name) throws SQLException {
        PreparedStatement statement = handle.prepare(FIND_BY_NAME);
        statement.setString(1, name);
        return categories(statement);
    }

    private List<Category> categories(PreparedStatement statement) throws SQLException {
        List<Category> categories = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                categories.add(new Category(
                    resultSet.getLong("id"),
                    resultSet.getString("name"),
                    resultSet.getInt("priority"),
                    Rows.nullableInt(resultSet, "retention_days")
                ));
            }
        }
        return categories;
    }
}
