package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import javax.annotation.Nullable;
import java.util.List;

/** A struct or a header type. */
public class P4TypeStruct extends P4Type implements IP4TypeDeclaration {
    public record Field(String name, P4Type type) {}

    public final String name;
    public final boolean header;
    public final List<Field> fields;

    public P4TypeStruct(SourcePositionRange position, String name, boolean header, List<Field> fields) {
        super(position);
        this.name = name;
        this.header = header;
        this.fields = fields;
    }

    @Nullable
    public Field getField(String name) {
        return Linq.first(this.fields, f -> f.name().equals(name));
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @Override
    public IIndentStream declare(IIndentStream builder) {
        builder.append(this.header ? "header " : "struct ")
                .append(this.name)
                .append(" {")
                .increase();
        for (Field field: this.fields)
            builder.append(field.type())
                    .append(" ")
                    .append(field.name())
                    .append(";")
                    .newline();
        return builder.decrease().append("}");
    }
}
