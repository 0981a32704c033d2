package com.work.zkreceipt.core.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.zkreceipt.core.exception.PolicyDocumentException;

import java.io.IOException;
import java.io.InputStream;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 从输入流读取策略文档（存储位置由上层决定，例如 classpath / 文件系统）。
 */
public class PolicyDocumentLoader {

    private final ObjectMapper objectMapper;

    public PolicyDocumentLoader() {
        this(new ObjectMapper());
    }

    public PolicyDocumentLoader(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "objectMapper")
                .copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ClaimTaxonomy loadClaimTaxonomy(InputStream in, String name) {
        return read(in, name, ClaimTaxonomy.class);
    }

    public SourcePrecedence loadSourcePrecedence(InputStream in, String name) {
        return read(in, name, SourcePrecedence.class);
    }

    private <T> T read(InputStream in, String name, Class<T> type) {
        if (in == null) {
            throw new PolicyDocumentException("failed to read " + name + ": not found");
        }
        try (InputStream input = in) {
            T doc = objectMapper.readValue(input, type);
            if (doc == null) {
                throw new PolicyDocumentException("failed to parse json " + name + ": empty document");
            }
            return doc;
        } catch (IOException e) {
            throw new PolicyDocumentException("failed to parse json " + name + ": " + e.getMessage(), e);
        }
    }
}
