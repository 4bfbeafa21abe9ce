package com.RK8.PriceChecker.Service;

import com.RK8.PriceChecker.DTO.CatalogEntry;
import com.RK8.PriceChecker.DTO.PriceCatalog;
import com.RK8.PriceChecker.Exception.CatalogLoadException;
import com.RK8.PriceChecker.Parser.CatalogExcelParser;
import com.RK8.PriceChecker.Parser.CatalogJsonParser;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Loads the master price list once at startup and hands out the immutable catalog.
 * A catalog that cannot be loaded stops the application from starting.
 */
@Slf4j
@Service
public class PriceCatalogService {

    private final ResourceLoader resourceLoader;
    private final CatalogJsonParser jsonParser;
    private final CatalogExcelParser excelParser;

    @Value("${pricecheck.catalog.location:classpath:master_price_list.json}")
    private String catalogLocation;

    private volatile PriceCatalog catalog = PriceCatalog.empty();

    public PriceCatalogService(ResourceLoader resourceLoader,
                               CatalogJsonParser jsonParser,
                               CatalogExcelParser excelParser) {
        this.resourceLoader = resourceLoader;
        this.jsonParser = jsonParser;
        this.excelParser = excelParser;
    }

    @PostConstruct
    public void loadOnStartup() {
        try {
            catalog = load(catalogLocation);
        } catch (CatalogLoadException e) {
            log.error("Failed to load master price list from {}", catalogLocation, e);
            throw e;
        }
    }

    public PriceCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogLoadException("Master price list not found: " + location);
        }

        List<CatalogEntry> entries;
        try (InputStream is = resource.getInputStream()) {
            entries = isWorkbook(location) ? excelParser.parse(is) : jsonParser.parse(is);
        } catch (IOException e) {
            throw new CatalogLoadException("Could not open master price list: " + location, e);
        }

        PriceCatalog loaded = new PriceCatalog(entries);
        if (loaded.isEmpty()) {
            log.warn("Master price list {} has no usable entries", location);
        }
        if (!loaded.getDuplicateIdentifiers().isEmpty()) {
            log.warn("Master price list has {} duplicate part numbers, first entry wins: {}",
                    loaded.getDuplicateIdentifiers().size(), loaded.getDuplicateIdentifiers());
        }
        log.info("Master price list loaded ({} entries) from {}", loaded.size(), location);
        return loaded;
    }

    public PriceCatalog getCatalog() {
        return catalog;
    }

    private boolean isWorkbook(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xlsx") || lower.endsWith(".xls");
    }
}
