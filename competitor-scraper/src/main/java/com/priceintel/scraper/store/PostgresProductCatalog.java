package com.priceintel.scraper.store;

import com.priceintel.scraper.model.LocalProduct;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class PostgresProductCatalog implements ProductCatalog {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<LocalProduct> findActiveProducts(String storeId, int limit, int offset) {
        return jdbcTemplate.query("""
                SELECT id::text AS id, name, sku
                FROM products
                WHERE store_id = ?::uuid AND status = 'active'
                ORDER BY updated_at DESC, id
                LIMIT ? OFFSET ?
                """,
                (rs, i) -> new LocalProduct(rs.getString("id"), rs.getString("name"), rs.getString("sku")),
                storeId, limit, offset);
    }

    @Override
    public int countActiveProducts(String storeId) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT count(*) FROM products WHERE store_id = ?::uuid AND status = 'active'
                """, Integer.class, storeId);
        return count == null ? 0 : count;
    }
}
