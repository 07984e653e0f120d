package io.flowdoc.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.flowdoc.core.conversion.ConversionResult;
import io.flowdoc.core.diff.Change;
import io.flowdoc.core.diff.DiffResult;
import io.flowdoc.core.diff.FieldDiff;
import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.core.layout.LayoutAlgorithm;
import io.flowdoc.core.layout.LayoutResult;
import io.flowdoc.serialization.mixin.ConversionResultMixin;
import io.flowdoc.serialization.mixin.DiffResultMixin;
import io.flowdoc.serialization.mixin.EnumValueMixin;
import io.flowdoc.serialization.mixin.LayoutResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Flowdoc serialization configuration in one place.
///
/// **Custom serializers**:
/// - `WorkflowDocument`: `WorkflowDocumentSerializer` / `WorkflowDocumentDeserializer`,
///   canonical field order, lenient reading
/// - `Change`: `ChangeSerializer`, discriminator `"type"` (write-only)
///
/// **Mixins** for engine result records, which stay free of Jackson annotations:
/// - `FieldDiff.Kind`, `LayoutAlgorithm`: written by wire name
/// - `DiffResult`, `ConversionResult`: derived flags hidden
/// - `LayoutResult`: derived `fellBack` flag added
///
/// The remaining result records (`ValidationResult`, `DocumentMetadata`, `Position`)
/// serialize through Jackson's built-in record support.
///
/// @see DocumentSerializer for the convenience factory API
public class FlowdocJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5190834477265130920L;

    public FlowdocJacksonModule() {
        super("FlowdocJacksonModule");

        addSerializer(WorkflowDocument.class, new WorkflowDocumentSerializer());
        addDeserializer(WorkflowDocument.class, new WorkflowDocumentDeserializer());
        addSerializer(Change.class, new ChangeSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(FieldDiff.Kind.class, EnumValueMixin.class);
        context.setMixInAnnotations(LayoutAlgorithm.class, EnumValueMixin.class);
        context.setMixInAnnotations(DiffResult.class, DiffResultMixin.class);
        context.setMixInAnnotations(ConversionResult.class, ConversionResultMixin.class);
        context.setMixInAnnotations(LayoutResult.class, LayoutResultMixin.class);
    }
}
