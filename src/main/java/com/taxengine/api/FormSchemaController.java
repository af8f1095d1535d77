package com.taxengine.api;

import com.taxengine.contract.TaxType;
import com.taxengine.schema.FormSchema;
import com.taxengine.schema.FormSchemaRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/forms")
public class FormSchemaController {

    private final FormSchemaRegistry schemaRegistry;

    public FormSchemaController(FormSchemaRegistry schemaRegistry) {
        this.schemaRegistry = schemaRegistry;
    }

    @PostMapping("/{taxType}/schemas")
    public FormSchema register(@PathVariable String taxType, @RequestBody Map<String, Object> schemaData) {
        return schemaRegistry.register(RequestValues.taxType(taxType, "tax_type"), schemaData);
    }

    @PostMapping("/{taxType}/schemas/{version}/activate")
    public FormSchema activate(@PathVariable String taxType, @PathVariable int version) {
        return schemaRegistry.activate(RequestValues.taxType(taxType, "tax_type"), version);
    }

    @GetMapping("/{taxType}/schema")
    public ResponseEntity<FormSchema> current(@PathVariable String taxType) {
        TaxType type = RequestValues.taxType(taxType, "tax_type");
        return schemaRegistry.current(type)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{taxType}/schemas")
    public List<FormSchema> versions(@PathVariable String taxType) {
        return schemaRegistry.versions(RequestValues.taxType(taxType, "tax_type"));
    }
}
