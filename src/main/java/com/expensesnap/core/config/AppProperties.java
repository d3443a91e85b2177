package com.expensesnap.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private Storage storage = new Storage();
    private Upload upload = new Upload();
    private Normalizer normalizer = new Normalizer();
    private Extraction extraction = new Extraction();
    private Rates rates = new Rates();

    public Storage getStorage(){ return storage; }
    public Upload getUpload(){ return upload; }
    public Normalizer getNormalizer(){ return normalizer; }
    public Extraction getExtraction(){ return extraction; }
    public Rates getRates(){ return rates; }

    public static class Storage {
        private String basePath = "var/receipts";
        public String getBasePath(){ return basePath; }
        public void setBasePath(String basePath){ this.basePath = basePath; }
    }

    public static class Upload {
        private long maxBytes = 50L * 1024 * 1024;
        public long getMaxBytes(){ return maxBytes; }
        public void setMaxBytes(long maxBytes){ this.maxBytes = maxBytes; }
    }

    public static class Normalizer {
        // 1.5 MB
        private long compressThresholdBytes = 1_572_864L;
        private int maxDimension = 2000;
        private float compressQuality = 0.80f;
        private float heicQuality = 0.85f;
        private List<String> heicCommand = new ArrayList<>(List.of("heif-convert", "{input}", "{output}"));
        private Duration heicTimeout = Duration.ofSeconds(30);
        private int pdfMaxPages = 10;
        private int pdfDpi = 200;

        public long getCompressThresholdBytes(){ return compressThresholdBytes; }
        public void setCompressThresholdBytes(long compressThresholdBytes){ this.compressThresholdBytes = compressThresholdBytes; }
        public int getMaxDimension(){ return maxDimension; }
        public void setMaxDimension(int maxDimension){ this.maxDimension = maxDimension; }
        public float getCompressQuality(){ return compressQuality; }
        public void setCompressQuality(float compressQuality){ this.compressQuality = compressQuality; }
        public float getHeicQuality(){ return heicQuality; }
        public void setHeicQuality(float heicQuality){ this.heicQuality = heicQuality; }
        public List<String> getHeicCommand(){ return heicCommand; }
        public void setHeicCommand(List<String> heicCommand){ this.heicCommand = heicCommand; }
        public Duration getHeicTimeout(){ return heicTimeout; }
        public void setHeicTimeout(Duration heicTimeout){ this.heicTimeout = heicTimeout; }
        public int getPdfMaxPages(){ return pdfMaxPages; }
        public void setPdfMaxPages(int pdfMaxPages){ this.pdfMaxPages = pdfMaxPages; }
        public int getPdfDpi(){ return pdfDpi; }
        public void setPdfDpi(int pdfDpi){ this.pdfDpi = pdfDpi; }
    }

    public static class Extraction {
        private String baseUrl = "https://api.anthropic.com";
        private String apiKey = "";
        private String model = "claude-sonnet-4-5-20250929";
        private int maxTokens = 1000;
        private String anthropicVersion = "2023-06-01";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(90);

        public String getBaseUrl(){ return baseUrl; }
        public void setBaseUrl(String baseUrl){ this.baseUrl = baseUrl; }
        public String getApiKey(){ return apiKey; }
        public void setApiKey(String apiKey){ this.apiKey = apiKey; }
        public String getModel(){ return model; }
        public void setModel(String model){ this.model = model; }
        public int getMaxTokens(){ return maxTokens; }
        public void setMaxTokens(int maxTokens){ this.maxTokens = maxTokens; }
        public String getAnthropicVersion(){ return anthropicVersion; }
        public void setAnthropicVersion(String anthropicVersion){ this.anthropicVersion = anthropicVersion; }
        public Duration getConnectTimeout(){ return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout){ this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout(){ return readTimeout; }
        public void setReadTimeout(Duration readTimeout){ this.readTimeout = readTimeout; }
    }

    public static class Rates {
        private String url = "https://open.er-api.com/v6/latest/USD";
        private Duration ttl = Duration.ofHours(1);
        private Duration timeout = Duration.ofSeconds(5);

        public String getUrl(){ return url; }
        public void setUrl(String url){ this.url = url; }
        public Duration getTtl(){ return ttl; }
        public void setTtl(Duration ttl){ this.ttl = ttl; }
        public Duration getTimeout(){ return timeout; }
        public void setTimeout(Duration timeout){ this.timeout = timeout; }
    }
}
