package com.weave.sampleapp.api;

import com.weave.routing.Handler;
import com.weave.routing.Handlers;
import com.weave.routing.Responders;
import com.weave.sampleapp.domain.Person;
import com.weave.sampleapp.views.HtmlViews;
import com.weave.sampleapp.views.ViewRenderer;

/**
 * HTML page responders.
 */
public class ViewHandlers {

    private final ViewRenderer renderer;

    public ViewHandlers(ViewRenderer renderer) {
        this.renderer = renderer;
    }

    /** Renders template {@code name} with {@code model} on every request. */
    public Handler view(String name, Object model) {
        return Handlers.deferred(request -> Responders.html(renderer.render(name, model)));
    }

    public Handler view(String name) {
        return view(name, null);
    }

    public Handler person(Person person) {
        return Responders.html(HtmlViews.person(person));
    }
}
