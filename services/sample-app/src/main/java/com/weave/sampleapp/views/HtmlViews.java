package com.weave.sampleapp.views;

import com.weave.sampleapp.domain.Person;
import org.springframework.web.util.HtmlUtils;

/**
 * Pages built in code rather than from a template.
 */
public final class HtmlViews {

    private HtmlViews() {
        // utility class
    }

    public static String person(Person person) {
        String name = HtmlUtils.htmlEscape(person.name());
        return "<!DOCTYPE html>"
                + "<html>"
                + "<head><title>Person</title></head>"
                + "<body><h1>Hello " + name + "</h1><p>Built in code.</p></body>"
                + "</html>";
    }
}
