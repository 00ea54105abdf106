package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.ir.P4Argument;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.p4Compiler.ir.type.P4TypeVar;
import org.p4c.util.Linq;
import org.p4c.util.Utilities;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Matches the arguments of a call with the parameters of the callee.
 * Positional arguments come first; the remaining ones are matched by name. */
public class ParameterSubstitution {
    final P4MethodCallExpression call;
    final P4TypeMethod methodType;
    final Map<P4Parameter, P4Argument> arguments;

    /**
     * @param call            Call whose arguments are matched.
     * @param methodType      Signature of the callee.
     * @param unboundAllowed  If true, directionless parameters may lack an argument;
     *                        this is the case for actions. */
    public ParameterSubstitution(P4MethodCallExpression call, P4TypeMethod methodType, boolean unboundAllowed) {
        this.call = call;
        this.methodType = methodType;
        this.arguments = new HashMap<>();

        List<P4Parameter> parameters = methodType.parameters;
        int index = 0;
        boolean named = false;
        for (P4Argument argument: call.arguments) {
            if (argument.name == null) {
                if (named)
                    throw new InternalCompilerError("Positional argument after named arguments", argument);
                if (index >= parameters.size())
                    throw new InternalCompilerError("Too many arguments in call", call);
                Utilities.putNew(this.arguments, parameters.get(index), argument);
                index++;
            } else {
                named = true;
                String name = argument.name;
                P4Parameter parameter = Linq.first(parameters, p -> p.name.equals(name));
                if (parameter == null)
                    throw new InternalCompilerError("No parameter named " + name, argument);
                if (this.arguments.containsKey(parameter))
                    throw new InternalCompilerError("Duplicate argument for parameter " + name, argument);
                this.arguments.put(parameter, argument);
            }
        }

        for (P4Parameter parameter: parameters) {
            if (this.arguments.containsKey(parameter))
                continue;
            if (!unboundAllowed || parameter.direction != P4Direction.NONE)
                throw new InternalCompilerError("No argument for parameter " + parameter.name, call);
        }
    }

    /** The parameters that have arguments, in declaration order. */
    public List<P4Parameter> getParameters() {
        return Linq.where(this.methodType.parameters, this.arguments::containsKey);
    }

    public P4Argument lookup(P4Parameter parameter) {
        return Utilities.getExists(this.arguments, parameter);
    }

    public boolean contains(P4Parameter parameter) {
        return this.arguments.containsKey(parameter);
    }

    /** The type of a parameter at this call site; type variables are replaced
     * with the explicit type arguments, or else with the type of the argument. */
    public P4Type parameterType(P4Parameter parameter) {
        P4TypeVar var = parameter.type.as(P4TypeVar.class);
        if (var == null)
            return parameter.type;
        if (!this.call.typeArguments.isEmpty()) {
            for (int i = 0; i < this.methodType.typeParameters.size(); i++) {
                if (this.methodType.typeParameters.get(i).name.equals(var.name)) {
                    if (i >= this.call.typeArguments.size())
                        break;
                    return this.call.typeArguments.get(i);
                }
            }
        }
        return this.lookup(parameter).expression.type;
    }
}
