package dev.pekelund.shelfscan.scanner.catalog;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Reads active catalog products from a Firestore collection. Documents without a name are skipped.
 */
public class FirestoreCatalogProductRepository implements CatalogProductRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreCatalogProductRepository.class);

    static final String STATUS_FIELD = "status";
    static final String ACTIVE_STATUS = "active";

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreCatalogProductRepository(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreCatalogProductRepository initialized with collection '{}'", collectionName);
    }

    @Override
    public List<CatalogProduct> listActiveProducts() {
        try {
            QuerySnapshot snapshot = firestore.collection(collectionName)
                .whereEqualTo(STATUS_FIELD, ACTIVE_STATUS)
                .get()
                .get();
            List<CatalogProduct> products = new ArrayList<>(snapshot.size());
            for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
                CatalogProduct product = toCatalogProduct(document.getId(), document.getData());
                if (product != null) {
                    products.add(product);
                }
            }
            LOGGER.info("Loaded {} active catalog products from '{}'", products.size(), collectionName);
            return products;
        } catch (InterruptedException ex) {
            LOGGER.error("Interrupted while reading catalog collection {}", collectionName, ex);
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException("Interrupted while reading the product catalog", ex);
        } catch (ExecutionException ex) {
            LOGGER.error("ExecutionException while reading catalog collection {}", collectionName, ex);
            throw new CatalogUnavailableException("Failed to read the product catalog from Firestore", ex);
        }
    }

    static CatalogProduct toCatalogProduct(String id, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String name = stringValue(data.get("name"));
        if (!StringUtils.hasText(name)) {
            LOGGER.debug("Skipping catalog document {} without a name", id);
            return null;
        }
        return new CatalogProduct(id, name, numberValue(data.get("price")), stringValue(data.get("description")),
            stringValue(data.get("brand")), stringValue(data.get("category")));
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }

    private static double numberValue(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                LOGGER.debug("Catalog price '{}' is not numeric; using 0", text);
                return 0.0;
            }
        }
        return 0.0;
    }
}
