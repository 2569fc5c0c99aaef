package com.products.scraper.parser.comfy;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ComfyProductInfoTest {

    private static final String PAGE = """
            <html><body><script>
            window.__INITIAL_STATE__ = {"page":{"product": {"id": 123456, "name":"iPhone"},
              "storeId": "5", "reviewsTotal": 37}};
            </script></body></html>
            """;

    @Test
    void shouldExtractIdentifiers() {
        Optional<ComfyProductInfo> info = ComfyProductInfo.fromPage(PAGE);

        assertThat(info).isPresent();
        assertThat(info.get().productId()).isEqualTo("123456");
        assertThat(info.get().storeId()).isEqualTo("5");
        assertThat(info.get().reviewsTotal()).isEqualTo(37);
        assertThat(info.get().pageSize()).isEqualTo(3);
    }

    @Test
    void pageSizeIsAtLeastOne() {
        assertThat(new ComfyProductInfo("1", "1", 7).pageSize()).isEqualTo(1);
        assertThat(new ComfyProductInfo("1", "1", 120).pageSize()).isEqualTo(12);
    }

    @Test
    void shouldRequireAllThreeValues() {
        assertThat(ComfyProductInfo.fromPage(PAGE.replace("\"storeId\": \"5\",", ""))).isEmpty();
        assertThat(ComfyProductInfo.fromPage(PAGE.replace("\"reviewsTotal\": 37", "\"reviews\": 37"))).isEmpty();
        assertThat(ComfyProductInfo.fromPage("<html>Pardon Our Interruption</html>")).isEmpty();
        assertThat(ComfyProductInfo.fromPage(null)).isEmpty();
    }

    @Test
    void shouldTreatZeroReviewsAsMissing() {
        assertThat(ComfyProductInfo.fromPage(PAGE.replace("37", "0"))).isEmpty();
    }
}
