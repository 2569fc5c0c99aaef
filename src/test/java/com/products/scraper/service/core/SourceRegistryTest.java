package com.products.scraper.service.core;

import com.products.scraper.model.RecordKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SourceRegistryTest {

    private static ProductSource<?> source(final String id, final String domain, final RecordKind kind) {
        ProductSource<?> source = mock(ProductSource.class);
        when(source.id()).thenReturn(id);
        when(source.domain()).thenReturn(domain);
        when(source.kind()).thenReturn(kind);
        return source;
    }

    private final ProductSource<?> hotline = source("hotline", "hotline.ua", RecordKind.OFFERS);
    private final ProductSource<?> comfy = source("comfy", "comfy.ua", RecordKind.COMMENTS);
    private final ProductSource<?> brain = source("brain", "brain.com.ua", RecordKind.COMMENTS);
    private final SourceRegistry registry = new SourceRegistry(List.of(hotline, comfy, brain));

    @Test
    void shouldDispatchByHostAndKind() {
        assertThat(registry.find("https://hotline.ua/ua/x/", RecordKind.OFFERS).orElseThrow()).isSameAs(hotline);
        assertThat(registry.find("https://comfy.ua/x.html", RecordKind.COMMENTS).orElseThrow()).isSameAs(comfy);
        assertThat(registry.find("https://brain.com.ua/x-p1.html", RecordKind.COMMENTS).orElseThrow()).isSameAs(brain);
    }

    @Test
    void shouldNotMatchOnPathOrQuery() {
        assertThat(registry.find("https://example.com/?ref=hotline.ua", RecordKind.OFFERS)).isEmpty();
        assertThat(registry.find("https://example.com/comfy.ua/x", RecordKind.COMMENTS)).isEmpty();
    }

    @Test
    void shouldRespectRecordKind() {
        assertThat(registry.find("https://comfy.ua/x.html", RecordKind.OFFERS)).isEmpty();
        assertThat(registry.find("https://hotline.ua/x/", RecordKind.COMMENTS)).isEmpty();
    }
}
