package com.streamfirst.olap.cooldown.ports.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamfirst.olap.cooldown.domain.CooldownConf;
import com.streamfirst.olap.cooldown.domain.CooldownMeta;
import com.streamfirst.olap.cooldown.domain.RowsetId;
import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.TabletMeta;
import com.streamfirst.olap.cooldown.domain.Version;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.util.List;

/**
 * JSON encoding of the two persisted documents: the local tablet meta and the remote
 * cooldown descriptor. The wire shape is kept in separate document records so the
 * domain types can evolve without changing files other replicas read.
 */
public final class MetaCodec {

    private final ObjectReader tabletReader;
    private final ObjectWriter tabletWriter;
    private final ObjectReader cooldownReader;
    private final ObjectWriter cooldownWriter;

    public MetaCodec() {
        ObjectMapper objectMapper = createObjectMapper();
        this.tabletReader = objectMapper.readerFor(TabletMetaDocument.class);
        this.tabletWriter = objectMapper.writerFor(TabletMetaDocument.class);
        this.cooldownReader = objectMapper.readerFor(CooldownMetaDocument.class);
        this.cooldownWriter = objectMapper.writerFor(CooldownMetaDocument.class);
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return objectMapper;
    }

    public void writeTabletMeta(TabletMeta meta, OutputStream output) throws IOException {
        tabletWriter.writeValue(output, TabletMetaDocument.from(meta));
    }

    public TabletMeta readTabletMeta(InputStream input) throws IOException {
        TabletMetaDocument document = tabletReader.readValue(input);
        return document.toDomain();
    }

    public byte[] encodeCooldownMeta(CooldownMeta meta) throws IOException {
        return cooldownWriter.writeValueAsBytes(CooldownMetaDocument.from(meta));
    }

    /**
     * Reads a remote descriptor.
     *
     * @throws MalformedMetaException if the content is truncated, not JSON, or not a valid descriptor
     */
    public CooldownMeta readCooldownMeta(InputStream input) throws IOException {
        try {
            CooldownMetaDocument document = cooldownReader.readValue(input);
            if (document == null) {
                throw new MalformedMetaException("Empty cooldown meta", null);
            }
            return document.toDomain();
        } catch (JsonProcessingException | IllegalArgumentException | NullPointerException e) {
            throw new MalformedMetaException("Malformed cooldown meta: " + e.getMessage(), e);
        }
    }

    public record RowsetDocument(
        long tabletId,
        String rowsetId,
        long startVersion,
        long endVersion,
        long numRows,
        List<Long> segmentSizes,
        Instant newestWriteTimestamp,
        String resourceId,
        List<String> segmentPaths
    ) {
        static RowsetDocument from(RowsetMeta rowset) {
            return new RowsetDocument(rowset.tabletId(), rowset.rowsetId().value(), rowset.version().start(),
                rowset.version().end(), rowset.numRows(), rowset.segmentSizes(), rowset.newestWriteTimestamp(),
                rowset.resourceId(), rowset.remoteSegmentPaths());
        }

        RowsetMeta toDomain() {
            return new RowsetMeta(tabletId, RowsetId.of(rowsetId), Version.of(startVersion, endVersion), numRows,
                nullToEmpty(segmentSizes), newestWriteTimestamp, resourceId, nullToEmpty(segmentPaths));
        }
    }

    public record TabletMetaDocument(
        long tabletId,
        int schemaHash,
        long replicaId,
        long storagePolicyId,
        long cooldownTerm,
        long cooldownReplicaId,
        List<RowsetDocument> rowsets
    ) {
        static TabletMetaDocument from(TabletMeta meta) {
            return new TabletMetaDocument(meta.tabletId(), meta.schemaHash(), meta.replicaId(),
                meta.storagePolicyId(), meta.cooldownConf().term(), meta.cooldownConf().cooldownReplicaId(),
                meta.rowsets().stream().map(RowsetDocument::from).toList());
        }

        TabletMeta toDomain() {
            return new TabletMeta(tabletId, schemaHash, replicaId, storagePolicyId,
                new CooldownConf(cooldownTerm, cooldownReplicaId),
                nullToEmpty(rowsets).stream().map(RowsetDocument::toDomain).toList());
        }
    }

    public record CooldownMetaDocument(long tabletId, long replicaId, long term, List<RowsetDocument> rowsets) {
        static CooldownMetaDocument from(CooldownMeta meta) {
            return new CooldownMetaDocument(meta.tabletId(), meta.replicaId(), meta.term(),
                meta.rowsets().stream().map(RowsetDocument::from).toList());
        }

        CooldownMeta toDomain() {
            return new CooldownMeta(tabletId, replicaId, term,
                nullToEmpty(rowsets).stream().map(RowsetDocument::toDomain).toList());
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
