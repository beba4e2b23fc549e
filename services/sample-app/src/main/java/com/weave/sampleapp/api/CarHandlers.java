package com.weave.sampleapp.api;

import com.weave.routing.Handler;
import com.weave.routing.Handlers;
import com.weave.routing.ModelBinder;
import com.weave.routing.Responders;
import com.weave.sampleapp.domain.Car;

/**
 * Model-binding demonstration.
 */
public final class CarHandlers {

    private CarHandlers() {
        // utility class
    }

    /** Binds the body (form or JSON) to a {@link Car} and echoes it as JSON. */
    public static Handler echoCar() {
        return Handlers.deferred(request -> Responders.json(ModelBinder.bind(request, Car.class)));
    }
}
