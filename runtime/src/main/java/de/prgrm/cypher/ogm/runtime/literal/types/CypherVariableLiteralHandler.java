package de.prgrm.cypher.ogm.runtime.literal.types;

import de.prgrm.cypher.ogm.runtime.literal.CypherVariable;
import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public class CypherVariableLiteralHandler extends AbstractTypedLiteralHandler<CypherVariable> {

    @Override
    protected Class<CypherVariable> getSupportedType() {
        return CypherVariable.class;
    }

    @Override
    protected String render(CypherVariable value, LiteralSerializer serializer) {
        return value.name();
    }
}
