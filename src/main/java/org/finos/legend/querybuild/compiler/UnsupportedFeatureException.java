package org.finos.legend.querybuild.compiler;

/**
 * A request used a construct the compiler refuses to emit, such as raw
 * HAVING text or an unknown operator.
 */
public class UnsupportedFeatureException extends QueryBuildException {

    public UnsupportedFeatureException(String message) {
        super(message);
    }
}
