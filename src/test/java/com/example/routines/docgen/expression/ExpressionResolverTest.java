package com.example.routines.docgen.expression;

import com.example.routines.docgen.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionResolverTest {
    private ExpressionResolver resolver;
    private Map<String, Object> data;

    @BeforeEach
    public void setUp() {
        resolver = new ExpressionResolver(new EngineProperties());

        Map<String, Object> day = new LinkedHashMap<>();
        day.put("nombre", "Pecho");
        Map<String, Object> routine = new LinkedHashMap<>();
        routine.put("uuid", "r-42");
        routine.put("dias", Arrays.asList(day, new LinkedHashMap<>(), new LinkedHashMap<>()));

        data = new HashMap<>();
        data.put("name", "juan pérez");
        data.put("gym", "Iron");
        data.put("routine", routine);
        data.put("week", 3);
        data.put("weight", 82.0);
        data.put("nothing", null);
    }

    @Test
    public void testPlainStringIsReturnedUnchanged() {
        String source = "No expressions here";
        assertSame(source, resolver.resolve(source, data));
        assertEquals(0, resolver.getCompiledCache().size());
    }

    @Test
    public void testNameAndNestedPathLookup() {
        assertEquals("Gym: Iron", resolver.resolve("Gym: {{ gym }}", data));
        assertEquals("Pecho", resolver.resolve("{{ routine.dias[0].nombre }}", data));
        assertEquals("r-42", resolver.resolve("{{ routine['uuid'] }}", data));
        assertEquals("82", resolver.resolve("{{ weight }}", data));
        assertEquals("[]", resolver.resolve("[{{ nothing }}]", data));
    }

    @Test
    public void testFilters() {
        assertEquals("Juan Pérez", resolver.resolve("{{ name | title }}", data));
        assertEquals("IRON", resolver.resolve("{{ gym | upper }}", data));
        assertEquals("3", resolver.resolve("{{ routine.dias | length }}", data));
        assertEquals("x", resolver.resolve("{{ missing | default('x') }}", data));
        assertEquals("x", resolver.resolve("{{ nothing | default(\"x\") }}", data));
        assertEquals("Iron", resolver.resolve("{{ gym | default('x') }}", data));
    }

    @Test
    public void testComparisonsAndLogic() {
        assertEquals("true", resolver.resolve("{{ week > 2 }}", data));
        assertEquals("false", resolver.resolve("{{ week == 4 }}", data));
        assertEquals("true", resolver.resolve("{{ gym == 'Iron' and not missing_flag | default(false) }}", data));
        assertEquals("Iron", resolver.resolve("{{ nothing or gym }}", data));
    }

    @Test
    public void testUndefinedVariableLeavesSourceUnchanged() {
        String source = "Hello {{ missing }}";
        assertEquals(source, resolver.resolve(source, data));
        assertEquals("{{ routine.dias[7].nombre }}", resolver.resolve("{{ routine.dias[7].nombre }}", data));
    }

    @Test
    public void testPrivateAttributesAreRejected() {
        assertEquals("{{ _secret }}", resolver.resolve("{{ _secret }}", Collections.singletonMap("_secret", "x")));
        assertEquals("{{ routine.__class__ }}", resolver.resolve("{{ routine.__class__ }}", data));
        assertFalse(resolver.precompile("{{ routine.__dict__ }}"));
    }

    @Test
    public void testStatementsAndUnknownFiltersAreRejected() {
        String loop = "{% for d in routine.dias %}x{% endfor %}";
        assertEquals(loop, resolver.resolve(loop, data));
        assertEquals("{{ gym | attr('x') }}", resolver.resolve("{{ gym | attr('x') }}", data));
        assertEquals("Unclosed {{ gym", resolver.resolve("Unclosed {{ gym", data));
    }

    @Test
    public void testNullDataIsTreatedAsEmpty() {
        assertEquals("fallback", resolver.resolve("{{ x | default('fallback') }}", null));
        assertEquals("", resolver.resolve(null, data));
    }

    @Test
    public void testCompiledCacheIsBoundedAndEvictsOldest() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxCompiledTemplates(2);
        ExpressionResolver bounded = new ExpressionResolver(properties);

        bounded.resolve("{{ gym }} 1", data);
        bounded.resolve("{{ gym }} 2", data);
        bounded.resolve("{{ gym }} 1", data);
        bounded.resolve("{{ gym }} 3", data);

        assertEquals(2, bounded.getCompiledCache().size());
        assertFalse(bounded.getCompiledCache().containsKey("{{ gym }} 1"));
        assertTrue(bounded.getCompiledCache().containsKey("{{ gym }} 3"));
    }

    @Test
    public void testResolveValueOnlyTouchesStrings() {
        assertEquals(5, resolver.resolveValue(5, data));
        assertEquals("Iron", resolver.resolveValue("{{ gym }}", data));
    }

    @Test
    public void testSubscriptBeyondIntRangeLeavesSourceUnresolved() {
        String source = "Hola {{ routine.dias[99999999999] }}";
        assertEquals(source, resolver.resolve(source, data));
        assertEquals("Pecho", resolver.resolve("{{ routine.dias[0].nombre }}", data));
    }

    @Test
    public void testDeeplyNestedExpressionLeavesSourceUnresolved() {
        StringBuilder nested = new StringBuilder("{{ ");
        for (int i = 0; i < 20000; i++) {
            nested.append('(');
        }
        nested.append("gym");
        for (int i = 0; i < 20000; i++) {
            nested.append(')');
        }
        nested.append(" }}");
        String source = nested.toString();

        assertEquals(source, resolver.resolve(source, data));
        assertFalse(resolver.precompile(source));
    }

    @Test
    public void testNestingLimit() {
        StringBuilder shallow = new StringBuilder();
        StringBuilder deep = new StringBuilder();
        for (int i = 0; i < ExpressionParser.MAX_DEPTH - 2; i++) {
            shallow.append("not ");
        }
        for (int i = 0; i < ExpressionParser.MAX_DEPTH + 1; i++) {
            deep.append("not ");
        }
        assertEquals("true", resolver.resolve("{{ " + shallow + "gym }}", data));
        String deepSource = "{{ " + deep + "gym }}";
        assertEquals(deepSource, resolver.resolve(deepSource, data));
    }

    @Test
    public void testLongOrChainLeavesSourceUnresolved() {
        assertEquals("Iron", resolver.resolve("{{ nothing or nothing or gym }}", data));

        StringBuilder chain = new StringBuilder("{{ nothing");
        for (int i = 1; i < 5000; i++) {
            chain.append(" or nothing");
        }
        chain.append(" or gym }}");
        String source = chain.toString();
        assertEquals(source, resolver.resolve(source, data));
    }
}
