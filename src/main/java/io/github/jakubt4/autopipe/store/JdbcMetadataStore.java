package io.github.jakubt4.autopipe.store;

import io.github.jakubt4.autopipe.model.FrameKind;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link MetadataStore}. One row per frame, keyed by absolute path.
 *
 * <p>Only the WCS summary (centre, pixel scale, projection type) is persisted; the
 * full mapping stays in the FITS header, which remains the source of truth.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcMetadataStore implements MetadataStore {

    private static final String SELECT_COLUMNS = """
            SELECT path, kind, capture_time, target, filter_name, exptime, gain, offset_adu, ccd_temp,
                   binning, size_x, size_y, integration_count, bias_subtracted, ra_hint, dec_hint
            FROM frames
            """;

    private static final String UPSERT = """
            INSERT INTO frames (path, kind, capture_time, target, filter_name, exptime, gain, offset_adu,
                                ccd_temp, binning, size_x, size_y, integration_count, bias_subtracted,
                                ra_center, dec_center, pixel_scale, wcs_type, ra_hint, dec_hint)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(path) DO UPDATE SET
                kind = excluded.kind,
                capture_time = excluded.capture_time,
                target = excluded.target,
                filter_name = excluded.filter_name,
                exptime = excluded.exptime,
                gain = excluded.gain,
                offset_adu = excluded.offset_adu,
                ccd_temp = excluded.ccd_temp,
                binning = excluded.binning,
                size_x = excluded.size_x,
                size_y = excluded.size_y,
                integration_count = excluded.integration_count,
                bias_subtracted = excluded.bias_subtracted,
                ra_center = excluded.ra_center,
                dec_center = excluded.dec_center,
                pixel_scale = excluded.pixel_scale,
                wcs_type = excluded.wcs_type,
                ra_hint = excluded.ra_hint,
                dec_hint = excluded.dec_hint
            """;

    private static final RowMapper<FrameMetadata> ROW_MAPPER = JdbcMetadataStore::mapRow;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<FrameMetadata> get(final Path path) {
        final var key = key(path);
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE path = ?", ROW_MAPPER, key)
                .stream()
                .findFirst();
    }

    @Override
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 200, maxDelay = 1000))
    public void upsert(final FrameMetadata frame) {
        final var wcs = frame.wcs();
        final var center = wcs == null ? null : wcs.center();
        jdbcTemplate.update(UPSERT,
                key(frame.path()),
                frame.kind().name(),
                frame.captureTime() == null ? null : frame.captureTime().toString(),
                frame.target(),
                frame.filter(),
                frame.exposure(),
                frame.gain(),
                frame.offset(),
                frame.temperature(),
                frame.binning(),
                frame.width(),
                frame.height(),
                frame.integrationCount(),
                frame.biasSubtracted() ? 1 : 0,
                center == null ? null : center.ra(),
                center == null ? null : center.dec(),
                wcs == null ? null : wcs.pixelScaleArcsec(),
                wcs == null ? null : "TAN",
                frame.raHint(),
                frame.decHint());
        log.debug("[STORE] Upserted {} {}", frame.kind(), frame.path());
    }

    @Recover
    public void recoverUpsert(final DataAccessException e, final FrameMetadata frame) {
        log.warn("[STORE] Upsert of {} failed after retries: {}", frame.path(), e.getMessage());
        throw new MetadataStoreException("Cannot upsert " + frame.path(), e);
    }

    @Override
    public List<FrameMetadata> query(final ReferenceQuery query) {
        final var sql = new StringBuilder(SELECT_COLUMNS).append("WHERE kind = ?");
        final List<Object> args = new ArrayList<>();
        args.add(query.kind().name());

        if (query.binning() != null) {
            sql.append(" AND binning = ?");
            args.add(query.binning());
        }
        if (query.filter() != null) {
            sql.append(" AND filter_name = ?");
            args.add(query.filter());
        }
        if (query.gain() != null) {
            sql.append(" AND gain = ?");
            args.add(query.gain());
        }
        if (query.offset() != null) {
            sql.append(" AND offset_adu = ?");
            args.add(query.offset());
        }
        if (query.minTemperature() != null) {
            sql.append(" AND ccd_temp >= ?");
            args.add(query.minTemperature());
        }
        if (query.maxTemperature() != null) {
            sql.append(" AND ccd_temp <= ?");
            args.add(query.maxTemperature());
        }
        if (query.minExposure() != null) {
            sql.append(" AND exptime >= ?");
            args.add(query.minExposure());
        }
        // capture_time is ISO-8601, so its first ten characters compare as dates
        if (query.producedOnOrBefore() != null) {
            sql.append(" AND substr(capture_time, 1, 10) <= ?");
            args.add(query.producedOnOrBefore().toString());
        }
        if (query.producedOnOrAfter() != null) {
            sql.append(" AND substr(capture_time, 1, 10) >= ?");
            args.add(query.producedOnOrAfter().toString());
        }
        sql.append(" ORDER BY path");

        return jdbcTemplate.query(sql.toString(), ROW_MAPPER, args.toArray());
    }

    private static String key(final Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    private static FrameMetadata mapRow(final ResultSet rs, final int rowNum) throws SQLException {
        return FrameMetadata.builder()
                .path(Path.of(rs.getString("path")))
                .kind(FrameKind.valueOf(rs.getString("kind")))
                .captureTime(LocalDateTime.parse(rs.getString("capture_time")))
                .target(rs.getString("target"))
                .filter(rs.getString("filter_name"))
                .exposure(nullableDouble(rs, "exptime"))
                .gain(nullableDouble(rs, "gain"))
                .offset(nullableDouble(rs, "offset_adu"))
                .temperature(nullableDouble(rs, "ccd_temp"))
                .binning(rs.getString("binning"))
                .width(rs.getInt("size_x"))
                .height(rs.getInt("size_y"))
                .integrationCount(rs.getInt("integration_count"))
                .biasSubtracted(rs.getInt("bias_subtracted") != 0)
                .raHint(rs.getString("ra_hint"))
                .decHint(rs.getString("dec_hint"))
                .build();
    }

    private static Double nullableDouble(final ResultSet rs, final String column) throws SQLException {
        final var value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
