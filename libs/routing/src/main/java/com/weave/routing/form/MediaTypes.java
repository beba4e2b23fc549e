package com.weave.routing.form;

import java.util.Locale;

/**
 * Content-type classification used by form reading and model binding.
 */
public final class MediaTypes {

    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";
    public static final String MULTIPART_FORM_DATA = "multipart/form-data";
    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
    public static final String TEXT_HTML_UTF8 = "text/html; charset=utf-8";

    private MediaTypes() {
        // utility class
    }

    /** Lower-cased type/subtype without parameters; empty string for null. */
    public static String baseType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semicolon = contentType.indexOf(';');
        String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return base.strip().toLowerCase(Locale.ROOT);
    }

    public static boolean isForm(String contentType) {
        String base = baseType(contentType);
        return base.equals(FORM_URLENCODED) || base.equals(MULTIPART_FORM_DATA);
    }

    public static boolean isMultipart(String contentType) {
        return baseType(contentType).equals(MULTIPART_FORM_DATA);
    }

    /** {@code application/json} or any {@code +json} suffix type. */
    public static boolean isJson(String contentType) {
        String base = baseType(contentType);
        return base.equals(APPLICATION_JSON) || base.endsWith("+json");
    }
}
