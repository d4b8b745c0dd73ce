package com.polyglot.backend.translation.provider;

/**
 * 外部翻譯服務。實作不丟例外，失敗一律回傳帶分類的 {@link ProviderResult}。
 */
public interface TranslationProvider {

    ProviderResult translate(String text, String sourceLang, String targetLang);

    String name();

    /**
     * OK：成功；TRANSIENT：可以重試；PERMANENT：重試也沒用。
     */
    record ProviderResult(
            Status status,
            String translatedText,
            Double confidence,
            String errorCode,
            String detail
    ) {
        public enum Status { OK, TRANSIENT, PERMANENT }

        public static ProviderResult ok(String translatedText, Double confidence) {
            return new ProviderResult(Status.OK, translatedText, confidence, null, null);
        }

        public static ProviderResult transientFailure(String errorCode, String detail) {
            return new ProviderResult(Status.TRANSIENT, null, null, errorCode, detail);
        }

        public static ProviderResult permanentFailure(String errorCode, String detail) {
            return new ProviderResult(Status.PERMANENT, null, null, errorCode, detail);
        }

        public boolean isOk() {
            return status == Status.OK;
        }
    }
}
